package com.contentorganizer.bot.extract;

import com.contentorganizer.bot.model.FileDescriptor;
import com.contentorganizer.bot.model.MessageMetadata;
import com.contentorganizer.bot.model.MessageType;
import com.contentorganizer.bot.model.Provenance;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Audio;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.Video;
import org.telegram.telegrambots.meta.api.objects.Voice;
import org.telegram.telegrambots.meta.api.objects.stickers.Sticker;

import java.time.Instant;
import java.util.List;

import static com.contentorganizer.bot.TelegramFixtures.photo;
import static com.contentorganizer.bot.TelegramFixtures.photoSize;
import static com.contentorganizer.bot.TelegramFixtures.text;
import static com.contentorganizer.bot.TelegramFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

class MetadataExtractorTest {

    private final User alice = user(1L, "Alice");

    @Test
    void plainTextIsText() {
        assertThat(MetadataExtractor.classify(text(1, alice, "hello"))).isEqualTo(MessageType.TEXT);
    }

    @Test
    void messageWithoutAnyContentIsText() {
        Message m = new Message();
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.TEXT);
    }

    @Test
    void photoWinsOverCaption() {
        Message m = photo(1, alice, "look #here", photoSize("small", 100));
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.PHOTO);
    }

    @Test
    void mediaPrecedenceFollowsFixedOrder() {
        Message m = new Message();
        m.setText("also text");
        m.setSticker(new Sticker());
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.STICKER);

        m.setVoice(new Voice());
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.VOICE);

        m.setAudio(new Audio());
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.AUDIO);

        m.setDocument(new Document());
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.DOCUMENT);

        m.setVideo(new Video());
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.VIDEO);

        m.setPhoto(List.of(photoSize("p", 1)));
        assertThat(MetadataExtractor.classify(m)).isEqualTo(MessageType.PHOTO);
    }

    @Test
    void urlsFromTextComeBeforeCaption() {
        List<String> urls = MetadataExtractor.extractUrls(
                "see https://a.example/x and http://b.example",
                "also https://c.example/?q=1");
        assertThat(urls).containsExactly("https://a.example/x", "http://b.example", "https://c.example/?q=1");
    }

    @Test
    void noMatchesGiveEmptyLists() {
        assertThat(MetadataExtractor.extractUrls(null, null)).isEmpty();
        assertThat(MetadataExtractor.extractHashtags("", "")).isEmpty();
        assertThat(MetadataExtractor.extractMentions("nothing here", null)).isEmpty();
        assertThat(MetadataExtractor.extractUrls("ftp://nope www.nope.com", null)).isEmpty();
    }

    @Test
    void hashtagsAreStrippedAndMayBeAdjacent() {
        assertThat(MetadataExtractor.extractHashtags("#a#b and #long_tag2!", "#cap"))
                .containsExactly("a", "b", "long_tag2", "cap");
    }

    @Test
    void mentionsAreStripped() {
        assertThat(MetadataExtractor.extractMentions("ping @bob and @carol_1", null))
                .containsExactly("bob", "carol_1");
    }

    @Test
    void urlFragmentIsReportedAsHashtag() {
        assertThat(MetadataExtractor.extractHashtags("https://docs.example/page#section", null))
                .containsExactly("section");
    }

    @Test
    void emailDomainIsReportedAsMention() {
        assertThat(MetadataExtractor.extractMentions("mail user@example.com", null))
                .containsExactly("example");
    }

    @Test
    void extractionIsStableOnItsOwnOutput() {
        String text = "go http://x.io/a #trip #a#b @me @you_2 user@host.org";

        for (String url : MetadataExtractor.extractUrls(text, null)) {
            assertThat(MetadataExtractor.extractUrls(url, null)).containsExactly(url);
        }
        for (String tag : MetadataExtractor.extractHashtags(text, null)) {
            assertThat(MetadataExtractor.extractHashtags("#" + tag, null)).containsExactly(tag);
        }
        for (String mention : MetadataExtractor.extractMentions(text, null)) {
            assertThat(MetadataExtractor.extractMentions("@" + mention, null)).containsExactly(mention);
        }
    }

    @Test
    void photoWithCaptionScenario() {
        Message m = photo(7, alice, "trip #summer check http://x.io",
                photoSize("thumb", 1200), photoSize("big", 90000));

        MessageMetadata meta = MetadataExtractor.extract(m);

        assertThat(meta.type).isEqualTo(MessageType.PHOTO);
        assertThat(meta.hashtags).containsExactly("summer");
        assertThat(meta.urls).containsExactly("http://x.io");
        assertThat(meta.mentions).isEmpty();
        assertThat(meta.file.fileId).isEqualTo("thumb");
        assertThat(meta.file.fileSize).isEqualTo(1200L);
        assertThat(meta.provenance).isNull();
    }

    @Test
    void videoCopiesPresentFieldsOnly() {
        Video v = new Video();
        v.setFileId("vid");
        v.setDuration(42);
        v.setMimeType("video/mp4");
        Message m = new Message();
        m.setVideo(v);

        FileDescriptor f = MetadataExtractor.fileMetadata(m, MessageType.VIDEO);

        assertThat(f.fileId).isEqualTo("vid");
        assertThat(f.duration).isEqualTo(42);
        assertThat(f.mimeType).isEqualTo("video/mp4");
        assertThat(f.fileName).isNull();
        assertThat(f.fileSize).isNull();
    }

    @Test
    void documentHasNoDuration() {
        Document d = new Document();
        d.setFileId("doc");
        d.setFileName("report.pdf");
        d.setMimeType("application/pdf");
        Message m = new Message();
        m.setDocument(d);

        FileDescriptor f = MetadataExtractor.fileMetadata(m, MessageType.DOCUMENT);

        assertThat(f.fileId).isEqualTo("doc");
        assertThat(f.fileName).isEqualTo("report.pdf");
        assertThat(f.mimeType).isEqualTo("application/pdf");
        assertThat(f.duration).isNull();
    }

    @Test
    void textHasNoFile() {
        FileDescriptor f = MetadataExtractor.fileMetadata(text(1, alice, "hi"), MessageType.TEXT);
        assertThat(f).isSameAs(FileDescriptor.NONE);
    }

    @Test
    void forwardedFromUserBuildsDisplayName() {
        User origin = user(5L, "Bob");
        origin.setLastName("Stone");
        origin.setUserName("bobs");
        Message m = text(1, alice, "fwd");
        m.setForwardFrom(origin);
        m.setForwardDate(1_700_000_000);

        Provenance p = MetadataExtractor.provenance(m);

        assertThat(p).isNotNull();
        assertThat(p.forwardedFrom).isEqualTo("Bob Stone (@bobs)");
        assertThat(p.forwardedDate).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void forwardedFromChannelUsesTitle() {
        Chat channel = new Chat();
        channel.setId(-100L);
        channel.setType("channel");
        channel.setTitle("Daily News");
        Message m = text(1, alice, "fwd");
        m.setForwardFromChat(channel);
        m.setForwardDate(1_700_000_000);

        assertThat(MetadataExtractor.provenance(m).forwardedFrom).isEqualTo("Daily News");
    }

    @Test
    void hiddenSenderFallsBackToSenderName() {
        Message m = text(1, alice, "fwd");
        m.setForwardSenderName("Anonymous Person");
        m.setForwardDate(1_700_000_000);

        assertThat(MetadataExtractor.provenance(m).forwardedFrom).isEqualTo("Anonymous Person");
    }

    @Test
    void notForwardedHasNoProvenance() {
        assertThat(MetadataExtractor.provenance(text(1, alice, "own words"))).isNull();
    }
}

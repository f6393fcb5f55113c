package im.arun.docsync.discourse;

import im.arun.docsync.exception.DiscourseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicUrlTest {

    private static final String BASE = "https://discourse.example.com";

    @Test
    void shouldParseSlugAndId() {
        TopicUrl url = TopicUrl.parse(BASE, BASE + "/t/getting-started/42");

        assertThat(url.getSlug()).isEqualTo("getting-started");
        assertThat(url.getTopicId()).isEqualTo(42L);
    }

    @Test
    void shouldAcceptTrailingSlash() {
        assertThat(TopicUrl.parse(BASE, BASE + "/t/doc/7/").getTopicId()).isEqualTo(7L);
    }

    @Test
    void shouldRejectOtherHost() {
        assertThatThrownBy(() -> TopicUrl.parse(BASE, "https://other.example.com/t/doc/1"))
                .isInstanceOf(DiscourseException.class)
                .hasMessageContaining("base path");
    }

    @Test
    void shouldRejectWrongComponentCount() {
        assertThatThrownBy(() -> TopicUrl.parse(BASE, BASE + "/t/doc"))
                .isInstanceOf(DiscourseException.class)
                .hasMessageContaining("number of path components");
    }

    @Test
    void shouldRejectNonTopicPath() {
        assertThatThrownBy(() -> TopicUrl.parse(BASE, BASE + "/c/doc/1"))
                .isInstanceOf(DiscourseException.class)
                .hasMessageContaining("first path component");
    }

    @Test
    void shouldRejectNonNumericId() {
        assertThat(TopicUrl.isValid(BASE, BASE + "/t/doc/abc")).isFalse();
        assertThat(TopicUrl.isValid(BASE, BASE + "/t//1")).isFalse();
        assertThat(TopicUrl.isValid(BASE, BASE + "/t/doc/1")).isTrue();
    }

    @Test
    void shouldConvertBetweenLinkAndUrl() {
        assertThat(TopicUrl.absolute(BASE, "/t/doc/1")).isEqualTo(BASE + "/t/doc/1");
        assertThat(TopicUrl.absolute(BASE, BASE + "/t/doc/1")).isEqualTo(BASE + "/t/doc/1");
        assertThat(TopicUrl.relative(BASE + "/t/doc/1")).isEqualTo("/t/doc/1");
    }
}

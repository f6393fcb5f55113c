package im.arun.docsync.navigation;

import im.arun.docsync.exception.NavigationTableException;
import im.arun.docsync.model.NavigationEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationTableCodecTest {

    private final NavigationTableCodec codec = new NavigationTableCodec();

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        void shouldRenderHeadingHeaderAndRows() {
            List<NavigationEntry> entries = List.of(
                    new NavigationEntry(1, "doc", "Doc", "/t/doc/1"),
                    NavigationEntry.group(1, "nested-dir", "Nested Dir"),
                    new NavigationEntry(2, "nested-dir-doc", "Nested Doc", "/t/nested-doc/2"));

            String table = codec.serialize(entries);

            assertThat(table).isEqualTo("# Navigation\n\n"
                    + "| Level | Path | Navlink |\n"
                    + "| -- | -- | -- |\n"
                    + "| 1 | doc | [Doc](/t/doc/1) |\n"
                    + "| 1 | nested-dir | [Nested Dir]() |\n"
                    + "| 2 | nested-dir-doc | [Nested Doc](/t/nested-doc/2) |\n");
        }

        @Test
        void shouldRenderEmptyTable() {
            assertThat(codec.serialize(List.of()))
                    .isEqualTo("# Navigation\n\n| Level | Path | Navlink |\n| -- | -- | -- |\n");
        }

        @Test
        void shouldEscapeTableSyntaxInTitles() {
            String table = codec.serialize(List.of(new NavigationEntry(1, "doc", "A | B [draft]", "/t/doc/1")));

            assertThat(table).contains("[A \\| B \\[draft\\]](/t/doc/1)");
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        void shouldReadBackWhatWasWritten() {
            List<NavigationEntry> entries = List.of(
                    new NavigationEntry(1, "doc", "Title with | pipe and [brackets] and \\", "/t/doc/1"),
                    NavigationEntry.group(1, "group", "Group"),
                    new NavigationEntry(2, "group-new", "New", NavigationEntry.NOT_CREATED_LINK));

            assertThat(codec.parse(codec.serialize(entries))).isEqualTo(entries);
        }

        @Test
        void shouldIgnoreContentAroundTable() {
            String body = "# Project\n\nIntro text.\n\n"
                    + "# Navigation\n\n"
                    + "| Level | Path | Navlink |\n"
                    + "|--|--|--|\n"
                    + "|  1 |  doc | [Doc](/t/doc/1)  |\n"
                    + "\n"
                    + "Footer that is not part of the table.\n";

            List<NavigationEntry> entries = codec.parse(body);

            assertThat(entries).containsExactly(new NavigationEntry(1, "doc", "Doc", "/t/doc/1"));
        }

        @Test
        void shouldReturnEmptyWithoutHeading() {
            assertThat(codec.parse("# Project\n\nNo table yet.")).isEmpty();
            assertThat(codec.parse(null)).isEmpty();
            assertThat(codec.parse("# Navigation\n\n")).isEmpty();
        }

        @Test
        void shouldRejectMissingHeader() {
            assertThatThrownBy(() -> codec.parse("# Navigation\n\n| 1 | doc | [Doc](/t/doc/1) |\n"))
                    .isInstanceOf(NavigationTableException.class);
        }

        @Test
        void shouldRejectMissingSeparator() {
            assertThatThrownBy(() -> codec.parse("# Navigation\n\n| Level | Path | Navlink |\n| 1 | doc | [Doc]() |\n"))
                    .isInstanceOf(NavigationTableException.class)
                    .hasMessageContaining("separator");
        }

        @Test
        void shouldRejectMalformedRow() {
            String body = "# Navigation\n\n| Level | Path | Navlink |\n| -- | -- | -- |\n| one | doc | Doc |\n";

            assertThatThrownBy(() -> codec.parse(body))
                    .isInstanceOf(NavigationTableException.class)
                    .hasMessageContaining("Invalid navigation table row");
        }

        @Test
        void shouldRejectNegativeLevel() {
            String body = "# Navigation\n\n| Level | Path | Navlink |\n| -- | -- | -- |\n| -1 | doc | [Doc]() |\n";

            assertThatThrownBy(() -> codec.parse(body))
                    .isInstanceOf(NavigationTableException.class)
                    .hasMessageContaining("Negative level");
        }

        @Test
        void shouldRejectDuplicatePaths() {
            String body = "# Navigation\n\n| Level | Path | Navlink |\n| -- | -- | -- |\n"
                    + "| 1 | doc | [Doc](/t/doc/1) |\n"
                    + "| 1 | doc | [Doc again](/t/doc/2) |\n";

            assertThatThrownBy(() -> codec.parse(body))
                    .isInstanceOf(NavigationTableException.class)
                    .hasMessageContaining("Duplicate path");
        }
    }
}

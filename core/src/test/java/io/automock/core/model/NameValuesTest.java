package io.automock.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link NameValues}. */
class NameValuesTest {

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        void allIsCaseInsensitive() {
            NameValues headers = NameValues.of("Content-Type", "application/json");
            assertThat(headers.all("content-type")).containsExactly("application/json");
            assertThat(headers.all("CONTENT-TYPE")).containsExactly("application/json");
        }

        @Test
        void absentNameYieldsEmptyListAndNullFirst() {
            NameValues headers = NameValues.of("Accept", "text/html");
            assertThat(headers.all("X-Missing")).isEmpty();
            assertThat(headers.first("X-Missing")).isNull();
            assertThat(headers.contains("x-missing")).isFalse();
        }

        @Test
        void firstReturnsFirstValue() {
            NameValues headers = NameValues.of("Accept", "text/html", "application/json");
            assertThat(headers.first("accept")).isEqualTo("text/html");
        }
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("Names differing only in case collapse into one entry")
        void caseInsensitiveUniqueness() {
            NameValues headers = new NameValues();
            headers.upsert("X-Trace", "a");
            headers.upsert("x-trace", "b");
            headers.upsert("X-TRACE", List.of("c", "d"));

            assertThat(headers.size()).isEqualTo(1);
            assertThat(headers.entries().get(0).name()).isEqualTo("X-Trace");
            assertThat(headers.all("x-trace")).containsExactly("c", "d");
        }

        @Test
        void replacesInPlaceKeepingPosition() {
            NameValues headers = new NameValues();
            headers.upsert("A", "1");
            headers.upsert("B", "2");
            headers.upsert("C", "3");
            headers.upsert("b", "two");

            assertThat(headers.entries())
                    .extracting(NameValue::name)
                    .containsExactly("A", "B", "C");
            assertThat(headers.first("B")).isEqualTo("two");
        }

        @Test
        void upsertIsIdempotent() {
            NameValues once = new NameValues();
            once.upsert("Cache-Control", "no-cache");
            NameValues twice = once.copy();
            twice.upsert("Cache-Control", "no-cache");

            assertThat(twice).isEqualTo(once);
        }

        @Test
        void fromMapCollapsesCollidingNames() {
            Map<String, List<String>> map = new LinkedHashMap<>();
            map.put("Accept", List.of("a"));
            map.put("accept", List.of("b"));

            NameValues values = NameValues.fromMap(map);
            assertThat(values.size()).isEqualTo(1);
            assertThat(values.all("ACCEPT")).containsExactly("b");
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        void deleteIsCaseInsensitive() {
            NameValues headers = NameValues.of("Content-Length", "12");
            assertThat(headers.delete("content-length")).isTrue();
            assertThat(headers.isEmpty()).isTrue();
        }

        @Test
        void deletingAbsentNameReportsFalse() {
            NameValues headers = NameValues.of("Accept", "*/*");
            assertThat(headers.delete("Connection")).isFalse();
            assertThat(headers.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Token merge")
    class TokenMerge {

        @Test
        void appendsTokenToExistingList() {
            NameValues headers = NameValues.of("Vary", "Origin");
            headers.mergeToken("Vary", "Accept-Encoding");
            assertThat(headers.all("Vary")).containsExactly("Origin, Accept-Encoding");
        }

        @Test
        void mergeIsIdempotentAndCaseInsensitive() {
            NameValues headers = NameValues.of("vary", "Origin, accept-encoding");
            headers.mergeToken("Vary", "Accept-Encoding");
            headers.mergeToken("Vary", "Accept-Encoding");
            assertThat(headers.all("Vary")).containsExactly("Origin, accept-encoding");
        }

        @Test
        void createsHeaderWhenAbsent() {
            NameValues headers = new NameValues();
            headers.mergeToken("Vary", "Accept-Encoding");
            assertThat(headers.all("Vary")).containsExactly("Accept-Encoding");
        }

        @Test
        void normalisesMultipleValuesAndDuplicates() {
            NameValues headers = NameValues.of("Vary", "Origin", "origin, Cookie");
            headers.mergeToken("Vary", "Cookie");
            assertThat(headers.all("Vary")).containsExactly("Origin, Cookie");
        }
    }

    @Nested
    @DisplayName("Copies and views")
    class CopiesAndViews {

        @Test
        void copyIsIndependent() {
            NameValues original = NameValues.of("Accept", "text/html");
            NameValues copy = original.copy();
            copy.upsert("Accept", "application/json");
            copy.upsert("X-New", "1");

            assertThat(original.all("Accept")).containsExactly("text/html");
            assertThat(original.contains("X-New")).isFalse();
        }

        @Test
        void replaceWithAdoptsEntriesInOrder() {
            NameValues target = NameValues.of("Old", "1");
            NameValues source = new NameValues();
            source.upsert("B", "2");
            source.upsert("A", "1");

            target.replaceWith(source);
            assertThat(target).isEqualTo(source);
            assertThat(target.contains("Old")).isFalse();
        }

        @Test
        void entriesViewIsUnmodifiable() {
            NameValues headers = NameValues.of("Accept", "*/*");
            assertThatThrownBy(() -> headers.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void multiValueMapKeepsSpellingAndOrder() {
            NameValues headers = new NameValues();
            headers.upsert("X-B", "2");
            headers.upsert("X-A", List.of("1", "one"));
            assertThat(headers.toMultiValueMap())
                    .containsExactly(Map.entry("X-B", List.of("2")), Map.entry("X-A", List.of("1", "one")));
        }
    }
}

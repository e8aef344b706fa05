package io.automock.core.matcher;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

/** Tests for {@link PathTemplates}. */
class PathTemplatesTest {

    @Test
    void splitsPathAndDecodesQuery() {
        PathTemplates.SplitPath split = PathTemplates.split("search?q=hello%20world&tag=a&tag=b&flag");

        assertThat(split.path()).isEqualTo("/search");
        assertThat(split.queryParameters().all("q")).containsExactly("hello world");
        assertThat(split.queryParameters().all("tag")).containsExactly("a", "b");
        assertThat(split.queryParameters().all("flag")).containsExactly("");
    }

    @Test
    void pathWithoutQueryIsKept() {
        PathTemplates.SplitPath split = PathTemplates.split("/users/42");
        assertThat(split.path()).isEqualTo("/users/42");
        assertThat(split.queryParameters().isEmpty()).isTrue();
    }

    @Test
    void malformedEscapeLeavesInputAsIs() {
        PathTemplates.SplitPath split = PathTemplates.split("/a?x=%zz");
        assertThat(split.path()).isEqualTo("/a?x=%zz");
        assertThat(split.queryParameters().isEmpty()).isTrue();
    }

    @Test
    void templateParameterNamesAreDistinctAndOrdered() {
        assertThat(PathTemplates.parameterNames("/orgs/{org}/users/{id}/orgs/{org}")).containsExactly("org", "id");
        assertThat(PathTemplates.isTemplate("/static/path")).isFalse();
    }

    @Test
    void literalRegexMatchesOnlyThePath() {
        String regex = PathTemplates.literalRegex("/a.b/(c)");
        assertThat(Pattern.matches(regex, "/a.b/(c)")).isTrue();
        assertThat(Pattern.matches(regex, "/aXb/(c)")).isFalse();
        assertThat(regex).startsWith("^").endsWith("$");
    }
}

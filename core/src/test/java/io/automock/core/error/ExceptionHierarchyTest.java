package io.automock.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: structure, kinds and common fields. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void expectationExceptionIsAbstractRoot() {
        assertThat(ExpectationException.class).isAbstract();
        assertThat(ExpectationException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void intermediateTiersAreAbstract() {
        assertThat(ExpectationValidationException.class).isAbstract();
        assertThat(ExpectationTransformException.class).isAbstract();
        assertThat(ExpectationValidationException.class.getSuperclass()).isEqualTo(ExpectationException.class);
        assertThat(ExpectationTransformException.class.getSuperclass()).isEqualTo(ExpectationException.class);
    }

    // --- Validation failures ---

    @Test
    void jsonValidationException() {
        var cause = new IllegalStateException("unexpected end");
        var ex = new JsonValidationException("request body", "{\"a\":", cause);

        assertThat(ex).isInstanceOf(ExpectationValidationException.class);
        assertThat(ex.kind()).isEqualTo(ExpectationException.Kind.VALIDATION);
        assertThat(ex.context()).isEqualTo("request body");
        assertThat(ex.content()).isEqualTo("{\"a\":");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.detail()).startsWith("JSON validation failed for request body: unexpected end");
    }

    @Test
    void regexValidationException() {
        var ex = new RegexValidationException("[a-", "path matching", null);

        assertThat(ex).isInstanceOf(ExpectationValidationException.class);
        assertThat(ex.pattern()).isEqualTo("[a-");
        assertThat(ex.getMessage()).isEqualTo("invalid regex pattern '[a-' for path matching");
    }

    @Test
    void inputValidationException() {
        var ex = new InputValidationException("priority", "-1", "a non-negative number");

        assertThat(ex).isInstanceOf(ExpectationValidationException.class);
        assertThat(ex.context()).isEqualTo("priority");
        assertThat(ex.value()).isEqualTo("-1");
        assertThat(ex.expected()).isEqualTo("a non-negative number");
        assertThat(ex.getMessage()).isEqualTo("invalid priority value '-1' (expected: a non-negative number)");
    }

    // --- Construction and transform failures ---

    @Test
    void matcherConstructionException() {
        var ex = new MatcherConstructionException("no parameters provided", "request body");

        assertThat(ex).isInstanceOf(ExpectationException.class).isNotInstanceOf(ExpectationValidationException.class);
        assertThat(ex.kind()).isEqualTo(ExpectationException.Kind.CONSTRUCTION);
    }

    @Test
    void compressionException() {
        var ex = new CompressionException("unsupported compression algorithm: br");

        assertThat(ex).isInstanceOf(ExpectationTransformException.class);
        assertThat(ex.kind()).isEqualTo(ExpectationException.Kind.TRANSFORM);
        assertThat(ex.context()).isEqualTo("response compression");
    }

    @Test
    void exportException() {
        var cause = new IOException("disk full");
        var ex = new ExportException("Failed to write expectations", cause, "/tmp/out.json");

        assertThat(ex).isInstanceOf(ExpectationTransformException.class);
        assertThat(ex.source()).isEqualTo("/tmp/out.json");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.context()).isEqualTo("wire format");
    }
}

package io.automock.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.automock.core.error.CompressionException;
import io.automock.core.matcher.BodyMatchers;
import io.automock.core.model.Body;
import io.automock.core.model.Expectation;
import io.automock.core.model.NameValues;
import io.automock.core.testkit.TestExpectations;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link CompressionTransformer}. */
class CompressionTransformerTest {

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    private static byte[] inflateRaw(byte[] compressed) throws IOException {
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed), new Inflater(true))) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            in.transferTo(out);
            return out.toByteArray();
        }
    }

    @Nested
    @DisplayName("Headers-only mode")
    class HeadersOnly {

        @Test
        void advertisesEncodingAndVary() {
            Expectation exp = TestExpectations.userLookup();
            Body bodyBefore = exp.response().body();

            CompressionTransformer.apply(exp, CompressionAlgorithm.GZIP, CompressionMode.HEADERS_ONLY);

            NameValues headers = exp.response().headers();
            assertThat(headers.first("Content-Encoding")).isEqualTo("gzip");
            assertThat(headers.all("Vary")).containsExactly("Accept-Encoding");
            assertThat(exp.response().body()).isSameAs(bodyBefore);
        }

        @Test
        @DisplayName("Vary merge is idempotent and keeps existing tokens")
        void varyMergeIsIdempotent() {
            Expectation exp = TestExpectations.userLookup();
            exp.response().headers().upsert("Vary", "Origin");

            CompressionTransformer.apply(exp, "gzip", CompressionMode.HEADERS_ONLY);
            CompressionTransformer.apply(exp, "gzip", CompressionMode.HEADERS_ONLY);

            assertThat(exp.response().headers().all("Vary")).containsExactly("Origin, Accept-Encoding");
        }

        @Test
        void identityRemovesEncoding() {
            Expectation exp = TestExpectations.userLookup();
            exp.response().headers().upsert("Content-Encoding", "gzip");

            CompressionTransformer.apply(exp, "identity", CompressionMode.HEADERS_ONLY);

            assertThat(exp.response().headers().contains("Content-Encoding")).isFalse();
        }

        @Test
        void unknownCodingIsAdvertisedVerbatim() {
            Expectation exp = TestExpectations.userLookup();
            CompressionTransformer.apply(exp, "BR", CompressionMode.HEADERS_ONLY);
            assertThat(exp.response().headers().first("content-encoding")).isEqualTo("br");
        }

        @Test
        void infersMissingContentType() {
            Expectation text = TestExpectations.textResponse("/t", "plain words");
            Expectation json = TestExpectations.textResponse("/j", " {\"a\": 1} ");

            CompressionTransformer.apply(text, "gzip", CompressionMode.HEADERS_ONLY);
            CompressionTransformer.apply(json, "gzip", CompressionMode.HEADERS_ONLY);

            assertThat(text.response().headers().first("Content-Type")).isEqualTo("text/plain; charset=utf-8");
            assertThat(json.response().headers().first("Content-Type")).isEqualTo("application/json");
        }

        @Test
        void keepsExplicitContentType() {
            Expectation exp = TestExpectations.textResponse("/t", "<p>hi</p>");
            exp.response().headers().upsert("content-type", "text/html");

            CompressionTransformer.apply(exp, "deflate", CompressionMode.HEADERS_ONLY);

            assertThat(exp.response().headers().all("Content-Type")).containsExactly("text/html");
        }
    }

    @Nested
    @DisplayName("Pre-compress mode")
    class PreCompress {

        @Test
        @DisplayName("Body, Content-Encoding and Content-Length describe the same gzip bytes")
        void gzipKeepsHeadersInSync() throws IOException {
            Expectation exp = TestExpectations.textResponse("/t", "hello hello hello hello");

            CompressionTransformer.apply(exp, CompressionAlgorithm.GZIP, CompressionMode.PRE_COMPRESS);

            Body.Binary body = (Body.Binary) exp.response().body();
            NameValues headers = exp.response().headers();
            assertThat(headers.first("Content-Encoding")).isEqualTo("gzip");
            assertThat(headers.first("Content-Length")).isEqualTo(Integer.toString(body.bytes().length));
            assertThat(headers.first("Content-Type")).isEqualTo("text/plain; charset=utf-8");
            assertThat(headers.all("Vary")).containsExactly("Accept-Encoding");
            assertThat(new String(gunzip(body.bytes()), StandardCharsets.UTF_8)).isEqualTo("hello hello hello hello");
        }

        @Test
        void jsonBodyIsCompressedAsCompactJson() throws IOException {
            Expectation exp = TestExpectations.textResponse("/j", "unused");
            exp.response().body(BodyMatchers.json("{ \"a\" : 1 }", null));

            CompressionTransformer.apply(exp, "gzip", CompressionMode.PRE_COMPRESS);

            Body.Binary body = (Body.Binary) exp.response().body();
            assertThat(new String(gunzip(body.bytes()), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
            assertThat(body.contentType()).isEqualTo("application/json");
        }

        @Test
        @DisplayName("Content-Type follows the rendered body even when one was already set")
        void renderedContentTypeReplacesConflictingHeader() {
            Expectation exp = TestExpectations.textResponse("/j", "unused");
            exp.response().body(BodyMatchers.json("{\"a\":1}", null));
            exp.response().headers().upsert("Content-Type", "text/html");

            CompressionTransformer.apply(exp, "gzip", CompressionMode.PRE_COMPRESS);

            assertThat(exp.response().headers().all("Content-Type")).containsExactly("application/json");
            assertThat(((Body.Binary) exp.response().body()).contentType()).isEqualTo("application/json");
        }

        @Test
        void deflateProducesRawStream() throws IOException {
            Expectation exp = TestExpectations.textResponse("/t", "deflate me");

            CompressionTransformer.apply(exp, "deflate", CompressionMode.PRE_COMPRESS);

            Body.Binary body = (Body.Binary) exp.response().body();
            assertThat(new String(inflateRaw(body.bytes()), StandardCharsets.UTF_8)).isEqualTo("deflate me");
            assertThat(exp.response().headers().first("Content-Encoding")).isEqualTo("deflate");
        }

        @Test
        void existingEtagIsRecomputedFromCompressedBytes() {
            Expectation exp = TestExpectations.textResponse("/t", "versioned");
            exp.response().headers().upsert("ETag", "\"stale\"");

            CompressionTransformer.apply(exp, "gzip", CompressionMode.PRE_COMPRESS);

            byte[] compressed = ((Body.Binary) exp.response().body()).bytes();
            assertThat(exp.response().headers().first("ETag")).isEqualTo(EntityTags.strong(compressed));
        }

        @Test
        void absentEtagIsNotAdded() {
            Expectation exp = TestExpectations.textResponse("/t", "no tag");
            CompressionTransformer.apply(exp, "gzip", CompressionMode.PRE_COMPRESS);
            assertThat(exp.response().headers().contains("ETag")).isFalse();
        }

        @Test
        void identityOnlyRemovesEncoding() {
            Expectation exp = TestExpectations.textResponse("/t", "plain");
            exp.response().headers().upsert("Content-Encoding", "gzip");

            CompressionTransformer.apply(exp, "identity", CompressionMode.PRE_COMPRESS);

            assertThat(exp.response().headers().contains("Content-Encoding")).isFalse();
            assertThat(exp.response().body()).isEqualTo(new Body.Text("plain"));
        }
    }

    @Nested
    @DisplayName("Failures leave the expectation unchanged")
    class Failures {

        @Test
        void unsupportedAlgorithmIsNamed() {
            Expectation exp = TestExpectations.userLookup();
            Expectation before = ExpectationCloner.deepClone(exp);

            assertThatThrownBy(() -> CompressionTransformer.apply(exp, "br", CompressionMode.PRE_COMPRESS))
                    .isInstanceOf(CompressionException.class)
                    .hasMessageContaining("br");
            assertThat(exp).isEqualTo(before);
        }

        @Test
        void requestOnlyBodyCannotBeRendered() {
            Expectation exp = TestExpectations.userLookup();
            exp.response().body(BodyMatchers.regex("a+"));
            exp.response().headers().upsert("ETag", "\"x\"");
            Expectation before = ExpectationCloner.deepClone(exp);

            assertThatThrownBy(() -> CompressionTransformer.apply(exp, "gzip", CompressionMode.PRE_COMPRESS))
                    .isInstanceOf(CompressionException.class)
                    .hasMessageContaining("REGEX");
            assertThat(exp).isEqualTo(before);
        }
    }

    @Test
    void entityTagIsQuotedSha1Hex() {
        assertThat(EntityTags.strong(new byte[0])).isEqualTo("\"da39a3ee5e6b4b0d3255bfef95601890afd80709\"");
        assertThat(EntityTags.strong("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("\"a9993e364706816aba3e25717850c26c9cd0d89d\"");
    }
}

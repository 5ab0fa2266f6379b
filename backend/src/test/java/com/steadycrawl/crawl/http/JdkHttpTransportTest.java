package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpTransportTest {
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void parsesProxyAddresses() {
        InetSocketAddress bare = JdkHttpTransport.proxyAddress("10.0.0.5:3128");
        InetSocketAddress withScheme = JdkHttpTransport.proxyAddress("http://proxy.internal:8080");

        assertThat(bare.getHostString()).isEqualTo("10.0.0.5");
        assertThat(bare.getPort()).isEqualTo(3128);
        assertThat(withScheme.getHostString()).isEqualTo("proxy.internal");
        assertThat(withScheme.getPort()).isEqualTo(8080);
        assertThatThrownBy(() -> JdkHttpTransport.proxyAddress("proxy-without-port"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void returnsErrorResponsesInsteadOfThrowing() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setHeader("Content-Type", "text/plain").setBody("busy"));
        server.start();
        JdkHttpTransport transport = new JdkHttpTransport(Duration.ofSeconds(2), null);

        HttpFetchResult result = transport.execute(
            FetchRequest.postJson(server.url("/api/search").toString(), "{\"q\":\"suv\"}"),
            null,
            Duration.ofSeconds(2)
        );

        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.body()).isEqualTo("busy");
        assertThat(result.contentType()).startsWith("text/plain");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"q\":\"suv\"}");
    }
}

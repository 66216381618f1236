package github.sarthakdev143.segment_forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP clients for the renderer and speech backends. Script previews, full renders and speech
 * synthesis each get their own read timeout.
 */
@Configuration
public class HttpClientConfig {

    public static final String PREVIEW_CLIENT = "previewRestClient";
    public static final String RENDER_CLIENT = "renderRestClient";
    public static final String SPEECH_CLIENT = "speechRestClient";

    @Bean(PREVIEW_CLIENT)
    public RestClient previewRestClient(RestClient.Builder builder, SegmentForgeProperties properties) {
        SegmentForgeProperties.Renderers renderers = properties.renderers();
        return withTimeouts(builder, renderers.connectTimeout(), renderers.previewTimeout());
    }

    @Bean(RENDER_CLIENT)
    public RestClient renderRestClient(RestClient.Builder builder, SegmentForgeProperties properties) {
        SegmentForgeProperties.Renderers renderers = properties.renderers();
        return withTimeouts(builder, renderers.connectTimeout(), renderers.renderTimeout());
    }

    @Bean(SPEECH_CLIENT)
    public RestClient speechRestClient(RestClient.Builder builder, SegmentForgeProperties properties) {
        return withTimeouts(builder, properties.renderers().connectTimeout(), properties.speech().timeout())
                .mutate()
                .baseUrl(properties.speech().url())
                .build();
    }

    private RestClient withTimeouts(RestClient.Builder builder, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return builder.clone()
                .requestFactory(factory)
                .build();
    }
}

package dev.aparikh.videosearch.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

/**
 * Reactor Netty backed transport, optionally hopping through a SOCKS5 proxy.
 */
class DefaultTransportProvider implements TransportProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultTransportProvider.class);

    private final WebClient client;
    private final boolean anonymized;

    DefaultTransportProvider(TransportProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
                .responseTimeout(properties.getResponseTimeout())
                .followRedirect(true);

        TransportProperties.Proxy proxy = properties.getProxy();
        this.anonymized = proxy.isEnabled();
        if (anonymized) {
            httpClient = httpClient.proxy(spec -> spec.type(ProxyProvider.Proxy.SOCKS5)
                    .host(proxy.getHost())
                    .port(proxy.getPort()));
            LOG.info("Routing source requests through SOCKS5 proxy {}:{}", proxy.getHost(), proxy.getPort());
        }

        int maxBodyBytes = (int) properties.getMaxBodySize().toBytes();
        this.client = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBodyBytes))
                .build();
    }

    @Override
    public WebClient client() {
        return client;
    }

    @Override
    public boolean isAnonymized() {
        return anonymized;
    }
}

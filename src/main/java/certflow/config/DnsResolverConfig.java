package certflow.config;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.DnsServerAddressStreamProviders;
import io.netty.resolver.dns.NoopDnsCache;
import io.netty.resolver.dns.SingletonDnsServerAddressStreamProvider;
import java.net.InetSocketAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class DnsResolverConfig {

    private static final int DNS_PORT = 53;

    @Bean(destroyMethod = "shutdownGracefully")
    public EventLoopGroup dnsEventLoopGroup() {
        return new NioEventLoopGroup(1);
    }

    /**
     * Uncached, so that repeated verification attempts observe propagation instead of an earlier negative answer.
     */
    @Bean(destroyMethod = "close")
    public DnsNameResolver dnsNameResolver(EventLoopGroup dnsEventLoopGroup, AppProperties appProperties) {
        final DnsNameResolverBuilder builder = new DnsNameResolverBuilder(dnsEventLoopGroup.next())
            .channelType(NioDatagramChannel.class)
            .queryTimeoutMillis(appProperties.responseTimeout().toMillis())
            .resolveCache(NoopDnsCache.INSTANCE)
            .recursionDesired(true);

        final String nameServer = appProperties.dns().nameServer();
        if (nameServer != null && !nameServer.isBlank()) {
            log.debug("Using name server={} for live lookups", nameServer);
            builder.nameServerProvider(new SingletonDnsServerAddressStreamProvider(parseAddress(nameServer)));
        } else {
            builder.nameServerProvider(DnsServerAddressStreamProviders.platformDefault());
        }
        return builder.build();
    }

    private static InetSocketAddress parseAddress(String value) {
        final int colon = value.lastIndexOf(':');
        if (colon > 0 && value.indexOf(':') == colon) {
            return new InetSocketAddress(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)));
        }
        return new InetSocketAddress(value, DNS_PORT);
    }
}

package certflow.services;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsRecordDecoder;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class NettyDnsLookup implements DnsLookup {

    private final DnsNameResolver resolver;

    public NettyDnsLookup(DnsNameResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Mono<List<String>> lookupNameServers(String zoneName) {
        return query(zoneName, DnsRecordType.NS, NettyDnsLookup::decodeNameServer);
    }

    @Override
    public Mono<List<String>> lookupTxt(String recordName) {
        return query(recordName, DnsRecordType.TXT, NettyDnsLookup::decodeTxt);
    }

    private Mono<List<String>> query(String name, DnsRecordType type, Function<ByteBuf, List<String>> decoder) {
        return Mono.<List<DnsRecord>>create(sink ->
                resolver.resolveAll(new DefaultDnsQuestion(name, type))
                    .addListener((FutureListener<List<DnsRecord>>) future -> {
                        if (future.isSuccess()) {
                            sink.success(future.getNow());
                        }
                        else {
                            sink.error(future.cause());
                        }
                    })
            )
            .map(records -> {
                try {
                    final List<String> values = new ArrayList<>();
                    for (final DnsRecord record : records) {
                        if (record.type().equals(type) && record instanceof DnsRawRecord rawRecord) {
                            values.addAll(decoder.apply(rawRecord.content()));
                        }
                    }
                    log.trace("Resolved type={} name={} values={}", type, name, values);
                    return values;
                } finally {
                    records.forEach(ReferenceCountUtil::release);
                }
            })
            .onErrorResume(UnknownHostException.class, e -> Mono.just(List.of()))
            .onErrorMap(e -> !(e instanceof DnsLookupException), e -> new DnsLookupException(name, type.name(), e));
    }

    /**
     * TXT rdata is a sequence of length prefixed character-strings.
     */
    static List<String> decodeTxt(ByteBuf content) {
        final ByteBuf in = content.duplicate();
        final List<String> strings = new ArrayList<>();
        while (in.isReadable()) {
            final int length = in.readUnsignedByte();
            strings.add(in.readCharSequence(length, StandardCharsets.UTF_8).toString());
        }
        return strings;
    }

    static List<String> decodeNameServer(ByteBuf content) {
        return List.of(trimTrailingDot(DefaultDnsRecordDecoder.decodeName(content.duplicate())));
    }

    static String trimTrailingDot(String name) {
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }
}

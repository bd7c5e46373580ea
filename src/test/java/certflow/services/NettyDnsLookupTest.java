package certflow.services;

import static org.assertj.core.api.Assertions.assertThat;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class NettyDnsLookupTest {

    @Test
    void txtRdataIsSplitIntoCharacterStrings() {
        final ByteBuf rdata = Unpooled.buffer();
        writeCharacterString(rdata, "first");
        writeCharacterString(rdata, "");
        writeCharacterString(rdata, "third value");

        assertThat(NettyDnsLookup.decodeTxt(rdata)).containsExactly("first", "", "third value");
        // reading works on a duplicate
        assertThat(rdata.readerIndex()).isZero();
        rdata.release();
    }

    @Test
    void nameServerLosesTrailingDot() {
        final ByteBuf rdata = Unpooled.buffer();
        writeLabel(rdata, "ns1");
        writeLabel(rdata, "provider");
        writeLabel(rdata, "net");
        rdata.writeByte(0);

        assertThat(NettyDnsLookup.decodeNameServer(rdata)).containsExactly("ns1.provider.net");
        rdata.release();
    }

    private static void writeCharacterString(ByteBuf buf, String value) {
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        buf.writeByte(bytes.length);
        buf.writeBytes(bytes);
    }

    private static void writeLabel(ByteBuf buf, String label) {
        writeCharacterString(buf, label);
    }
}

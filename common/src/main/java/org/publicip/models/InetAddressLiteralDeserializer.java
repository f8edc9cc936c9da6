package org.publicip.models;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import org.publicip.Common;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Reads an {@link InetAddress} from an IP literal only. Jackson's default deserializer resolves host names,
 * which would make reading a cache file perform DNS queries.
 */
public class InetAddressLiteralDeserializer extends StdScalarDeserializer<InetAddress> {
    public InetAddressLiteralDeserializer() {
        super(InetAddress.class);
    }

    @Override
    public InetAddress deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        var text = p.getValueAsString();
        var address = Common.parseAddress(text);
        if (address == null) {
            return (InetAddress) ctxt.handleWeirdStringValue(InetAddress.class, String.valueOf(text),
                    "not an IP address literal");
        }
        return address;
    }
}

package io.consul.spec;

import java.io.IOException;
import java.math.BigInteger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

class UnsignedLongSerializer extends StdSerializer<Long> {

    UnsignedLongSerializer() {
        super(Long.class);
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value < 0) {
            gen.writeNumber(new BigInteger(Long.toUnsignedString(value)));
        } else {
            gen.writeNumber(value.longValue());
        }
    }
}

package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.model.Value;
import com.dumpgraph.core.model.ValueKind;
import com.dumpgraph.core.model.ValuePayload;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds values from {@code values/value} elements.
 *
 * <p>A value carries at most one payload: {@code intvalue}, {@code tokvalue},
 * {@code floatvalue} or {@code container-size}. Values without one (uninitialized or
 * moved-from states) are kept with {@link ValuePayload#NONE}.
 */
public class ValueRecordBuilder implements RecordBuilder<Value> {

    public static final String TAG = "value";

    private static final String[] PAYLOADS = {"intvalue", "tokvalue", "floatvalue", "container-size"};

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Value build(ElementAttributes attributes) {
        String payload = payloadOf(attributes);
        ValueKind kind = kindOf(attributes);
        boolean inconclusive = attributes.flag("inconclusive");
        Integer conditionLine = attributes.optionalInt("condition-line");

        if (payload == null) {
            return Value.withoutPayload(kind, inconclusive, conditionLine);
        }
        return switch (payload) {
            case "intvalue" -> Value.ofInt(attributes.optionalLong("intvalue"), kind, inconclusive, conditionLine);
            case "tokvalue" -> Value.ofToken(attributes.get("tokvalue"), kind, inconclusive, conditionLine);
            case "floatvalue" -> Value.ofFloat(attributes.optionalDouble("floatvalue"), kind, inconclusive, conditionLine);
            default -> Value.ofContainerSize(attributes.optionalLong("container-size"), kind, inconclusive, conditionLine);
        };
    }

    static ValueKind kindOf(ElementAttributes attributes) {
        if (attributes.flag("known")) {
            return ValueKind.KNOWN;
        }
        if (attributes.flag("possible")) {
            return ValueKind.POSSIBLE;
        }
        return ValueKind.UNSPECIFIED;
    }

    private static String payloadOf(ElementAttributes attributes) {
        String found = null;
        for (String name : PAYLOADS) {
            String raw = attributes.get(name);
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            if (found != null) {
                throw new DumpFormatException("Value at line " + attributes.line()
                    + " has both '" + found + "' and '" + name + "'");
            }
            found = name;
        }
        return found;
    }
}

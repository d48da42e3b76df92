package com.sc2.replay.attribute;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.exception.AttributeDecodeException;
import com.sc2.replay.exception.UnknownCodeException;
import com.sc2.replay.model.Attribute;
import com.sc2.replay.model.RawAttributeRecord;

/**
 * Turns raw attribute records into named, typed {@link Attribute}s.
 *
 * Decoding a record:
 * - strips trailing NUL bytes from the value
 * - looks the code up in {@link AttributeCodeTable}
 * - applies the code's {@link ValueTransform}, if any
 *
 * Codes missing from the table are kept under the name "Unknown" with their raw string value.
 * A table lookup miss is an error, never a silent fallback.
 */
public class AttributeDecoder {
    private static final Logger log = LoggerFactory.getLogger(AttributeDecoder.class);

    private final DecoderConfig config;

    public AttributeDecoder() {
        this(DecoderConfig.defaults());
    }

    public AttributeDecoder(DecoderConfig config) {
        this.config = config;
    }

    /**
     * Decode a single record.
     *
     * @throws UnknownCodeException     if a table-lookup attribute holds a key the table lacks
     * @throws AttributeDecodeException if a computed attribute holds a value it cannot compute from
     */
    public Attribute decode(RawAttributeRecord record) {
        int code = record.getCode();
        int owner = record.getOwnerIndex();
        // ISO-8859-1 keeps a one-to-one byte/char mapping
        String stripped = new String(record.strippedValue(), StandardCharsets.ISO_8859_1);

        Optional<AttributeCode> known = AttributeCodeTable.lookup(code);
        if (known.isEmpty()) {
            return Attribute.ofString(code, owner, Attribute.UNKNOWN_NAME, stripped);
        }

        AttributeCode attributeCode = known.get();
        ValueTransform transform = attributeCode.getTransform();
        String name = attributeCode.getDisplayName();

        return switch (transform.getKind()) {
            case NONE -> Attribute.ofString(code, owner, name, stripped);
            case TABLE_LOOKUP -> Attribute.ofString(code, owner, name, lookup(transform, stripped, code, owner));
            case COMPUTED -> Attribute.ofInteger(code, owner, name, compute(transform, stripped, code, owner));
        };
    }

    /**
     * Decode every record, isolating failures per record.
     * In strict mode the first failure is rethrown.
     */
    public AttributeSet decodeAll(List<RawAttributeRecord> records, DecodeDiagnostics diagnostics) {
        List<Attribute> attributes = new ArrayList<>(records.size());

        for (RawAttributeRecord record : records) {
            try {
                Attribute attribute = decode(record);
                diagnostics.recordDecoded();

                if (!attribute.isKnown()) {
                    diagnostics.getWarnings().add(String.format("Unknown attribute code 0x%04X (owner %d)",
                            record.getCode(), record.getOwnerIndex()));
                    if (!config.isKeepUnknown()) {
                        log.debug("Dropping unknown attribute {}", attribute);
                        continue;
                    }
                }

                log.debug("Decoded {}", attribute);
                attributes.add(attribute);
            } catch (AttributeDecodeException e) {
                if (config.isStrict()) {
                    throw e;
                }
                diagnostics.getErrors().add(e.getMessage());
                log.warn("Skipping attribute record: {}", e.getMessage());
            }
        }

        return new AttributeSet(attributes);
    }

    private String lookup(ValueTransform transform, String key, int code, int owner) {
        try {
            return transform.getTable().resolve(key);
        } catch (UnknownCodeException e) {
            throw e.forAttribute(code, owner);
        }
    }

    private int compute(ValueTransform transform, String value, int code, int owner) {
        try {
            return transform.getFunction().applyAsInt(value);
        } catch (IllegalArgumentException e) {
            throw new AttributeDecodeException(code, owner,
                    "cannot compute " + transform.getFunctionName() + " of '" + value + "'", e);
        }
    }
}

package com.jonathantong.SensorRelay.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Conversions applied to raw column values coming from the binlog or from JDBC.
 * None of these methods throw on bad input.
 */
public final class ValueDecoding {

    private static final DateTimeFormatter ISO_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter ISO_MICROS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx").withZone(ZoneOffset.UTC);

    private ValueDecoding() {
    }

    /**
     * Decode a column value to text: strict UTF-8 first, then ISO-8859-1,
     * and a lossy UTF-8 decoding as the last resort
     */
    public static String decodeText(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof byte[])) {
            return value.toString();
        }

        byte[] bytes = (byte[]) value;
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            try {
                return StandardCharsets.ISO_8859_1.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException fallback) {
                return new String(bytes, StandardCharsets.UTF_8);
            }
        }
    }

    /**
     * Convert a numeric identifier column to a long, or null when it is absent or not numeric
     */
    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        String text = decodeText(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Convert an epoch-seconds column (Home Assistant stores fractional seconds as DOUBLE)
     * to an instant rounded to microseconds. Returns null when the value is absent or unusable.
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }

        BigDecimal seconds;
        try {
            if (value instanceof BigDecimal) {
                seconds = (BigDecimal) value;
            } else if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    return null;
                }
                seconds = BigDecimal.valueOf(d);
            } else if (value instanceof Number) {
                seconds = BigDecimal.valueOf(((Number) value).longValue());
            } else {
                String text = decodeText(value).trim();
                if (text.isEmpty()) {
                    return null;
                }
                seconds = new BigDecimal(text);
            }

            long micros = seconds.movePointRight(6).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
            return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            return null;
        }
    }

    /**
     * Render an instant as ISO-8601 with an explicit +00:00 offset,
     * adding microseconds only when they are non-zero
     */
    public static String toIsoTimestamp(Instant instant) {
        if (instant.getNano() / 1_000 == 0) {
            return ISO_SECONDS.format(instant);
        }
        return ISO_MICROS.format(instant);
    }
}

package eu.fbk.graphstore.data;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;
import com.google.common.primitives.Longs;
import com.google.common.primitives.UnsignedBytes;

/**
 * The standard {@link IdSpace}s.
 */
public final class IdSpaces {

    /** Random 128-bit identifiers, ordered as unsigned big-endian numbers. */
    public static final IdSpace<UUID> UUID = new UuidSpace();

    /** Signed 64-bit identifiers, ordered numerically. */
    public static final IdSpace<Long> LONG = new LongSpace();

    /**
     * Textual identifiers, ordered by Unicode code point. Strings with unpaired surrogates are
     * not valid identifiers, as they cannot be encoded in UTF-8 without loss.
     */
    public static final IdSpace<String> STRING = new StringSpace();

    private IdSpaces() {
    }

    /**
     * Returns the standard {@code IdSpace} with the name specified.
     * 
     * @param name
     *            the space name, either {@code uuid}, {@code long} or {@code string}
     * @return the corresponding {@code IdSpace}
     * @throws IllegalArgumentException
     *             if there is no space with that name
     */
    public static IdSpace<?> forName(final String name) {
        for (final IdSpace<?> space : new IdSpace<?>[] { UUID, LONG, STRING }) {
            if (space.getName().equalsIgnoreCase(name.trim())) {
                return space;
            }
        }
        throw new IllegalArgumentException("Unknown identifier space '" + name + "'");
    }

    private static final class UuidSpace implements IdSpace<UUID> {

        @Override
        public String getName() {
            return "uuid";
        }

        @Override
        public Class<UUID> getIdClass() {
            return UUID.class;
        }

        @Override
        public int compare(final UUID first, final UUID second) {
            final int result = Long.compareUnsigned(first.getMostSignificantBits(),
                    second.getMostSignificantBits());
            return result != 0 ? result : Long.compareUnsigned(first.getLeastSignificantBits(),
                    second.getLeastSignificantBits());
        }

        @Override
        public byte[] toBytes(final UUID id) {
            final byte[] bytes = new byte[16];
            System.arraycopy(Longs.toByteArray(id.getMostSignificantBits()), 0, bytes, 0, 8);
            System.arraycopy(Longs.toByteArray(id.getLeastSignificantBits()), 0, bytes, 8, 8);
            return bytes;
        }

        @Override
        public UUID fromBytes(final byte[] bytes) {
            Preconditions.checkArgument(bytes.length == 16, "Invalid UUID length %s",
                    bytes.length);
            return new UUID(Longs.fromBytes(bytes[0], bytes[1], bytes[2], bytes[3], bytes[4],
                    bytes[5], bytes[6], bytes[7]), Longs.fromBytes(bytes[8], bytes[9], bytes[10],
                    bytes[11], bytes[12], bytes[13], bytes[14], bytes[15]));
        }

        @Override
        public String toText(final UUID id) {
            return id.toString();
        }

        @Override
        public UUID fromText(final String text) throws ValidationException {
            try {
                final UUID id = java.util.UUID.fromString(text);
                if (!id.toString().equalsIgnoreCase(text)) {
                    throw new IllegalArgumentException("non canonical form");
                }
                return id;
            } catch (final IllegalArgumentException ex) {
                throw new ValidationException(ValidationException.Reason.INVALID_VALUE,
                        "Invalid UUID '" + text + "'");
            }
        }

        @Override
        public UUID successor(final UUID id) throws ValidationException {
            long msb = id.getMostSignificantBits();
            long lsb = id.getLeastSignificantBits();
            if (lsb == -1L) {
                if (msb == -1L) {
                    throw new ValidationException(
                            ValidationException.Reason.CANNOT_INCREMENT_UUID,
                            "Could not increment UUID " + id);
                }
                ++msb;
            }
            ++lsb;
            return new UUID(msb, lsb);
        }

        @Override
        public UUID generate() {
            return java.util.UUID.randomUUID();
        }

        @Override
        public String toString() {
            return getName();
        }

    }

    private static final class LongSpace implements IdSpace<Long> {

        @Override
        public String getName() {
            return "long";
        }

        @Override
        public Class<Long> getIdClass() {
            return Long.class;
        }

        @Override
        public int compare(final Long first, final Long second) {
            return Long.compare(first, second);
        }

        @Override
        public byte[] toBytes(final Long id) {
            return Longs.toByteArray(id ^ Long.MIN_VALUE); // flip sign to keep byte order
        }

        @Override
        public Long fromBytes(final byte[] bytes) {
            Preconditions.checkArgument(bytes.length == 8, "Invalid long length %s",
                    bytes.length);
            return Longs.fromByteArray(bytes) ^ Long.MIN_VALUE;
        }

        @Override
        public String toText(final Long id) {
            return id.toString();
        }

        @Override
        public Long fromText(final String text) throws ValidationException {
            try {
                return Long.parseLong(text);
            } catch (final NumberFormatException ex) {
                throw new ValidationException(ValidationException.Reason.INVALID_VALUE,
                        "Invalid long identifier '" + text + "'");
            }
        }

        @Override
        public Long successor(final Long id) throws ValidationException {
            if (id == Long.MAX_VALUE) {
                throw new ValidationException(ValidationException.Reason.CANNOT_INCREMENT_UUID,
                        "Could not increment identifier " + id);
            }
            return id + 1;
        }

        @Override
        public Long generate() {
            return ThreadLocalRandom.current().nextLong();
        }

        @Override
        public String toString() {
            return getName();
        }

    }

    private static final class StringSpace implements IdSpace<String> {

        @Override
        public String getName() {
            return "string";
        }

        @Override
        public Class<String> getIdClass() {
            return String.class;
        }

        @Override
        public int compare(final String first, final String second) {
            // UTF-8 byte order is code point order, which differs from String.compareTo()
            return UnsignedBytes.lexicographicalComparator().compare(toBytes(first),
                    toBytes(second));
        }

        @Override
        public byte[] toBytes(final String id) {
            Utf8.encodedLength(id); // rejects unpaired surrogates
            return id.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String fromBytes(final byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public String toText(final String id) {
            return id;
        }

        @Override
        public String fromText(final String text) throws ValidationException {
            try {
                Utf8.encodedLength(text);
            } catch (final IllegalArgumentException ex) {
                throw new ValidationException(ValidationException.Reason.INVALID_VALUE,
                        "Invalid string identifier: " + ex.getMessage());
            }
            return text;
        }

        @Override
        public String successor(final String id) {
            return id + '\u0000';
        }

        @Override
        public String generate() {
            return java.util.UUID.randomUUID().toString();
        }

        @Override
        public String toString() {
            return getName();
        }

    }

}

package io.blockchain.mining.protocol;

/**
 * Output descriptors for a single, non-ranged script: {@code raw(HEX)}, {@code addr(ADDRESS)},
 * {@code pk(KEY)} and {@code pkh(KEY)}, each optionally followed by {@code #checksum}.
 */
public final class Descriptor {
    private static final String INPUT_CHARSET =
            "0123456789()[],'/*abcdefgh@:$%{}"
            + "IJKLMNOPQRSTUVWXYZ&+-.;<=>?!^_|~"
            + "ijklmnopqrstuvwxyzABCDEFGH`#\"\\ ";
    private static final String CHECKSUM_CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final long[] GENERATOR = {
            0xf5dee51989L, 0xa9fdca3312L, 0x1bab10e32dL, 0x3706b1677aL, 0x644d626ffdL
    };
    private static final int CHECKSUM_LENGTH = 8;

    private final String text;
    private final Script script;
    private final boolean ranged;

    private Descriptor(String text, Script script, boolean ranged) {
        this.text = text;
        this.script = script;
        this.ranged = ranged;
    }

    /** Thrown for any descriptor that cannot be turned into a script. */
    public static final class ParseException extends IllegalArgumentException {
        public ParseException(String message) { super(message); }
    }

    public static Descriptor parse(String input) {
        if (input == null || input.isBlank()) {
            throw new ParseException("descriptor required");
        }
        String body = input;
        int hashPos = input.indexOf('#');
        if (hashPos >= 0) {
            body = input.substring(0, hashPos);
            String provided = input.substring(hashPos + 1);
            if (provided.length() != CHECKSUM_LENGTH) {
                throw new ParseException("Expected " + CHECKSUM_LENGTH + " character checksum, not "
                        + provided.length() + " characters");
            }
            String computed = checksum(body);
            if (computed.isEmpty()) {
                throw new ParseException("Invalid characters in payload");
            }
            if (!computed.equals(provided)) {
                throw new ParseException("Provided checksum '" + provided
                        + "' does not match computed checksum '" + computed + "'");
            }
        }

        int open = body.indexOf('(');
        if (open <= 0 || !body.endsWith(")")) {
            throw new ParseException("'" + body + "' is not a valid descriptor function");
        }
        String function = body.substring(0, open);
        String arg = body.substring(open + 1, body.length() - 1);

        switch (function) {
            case "raw":
                if (!Hex.isHex(arg)) throw new ParseException("Raw script is not hex");
                return new Descriptor(body, new Script(Hex.decode(arg)), false);
            case "addr":
                if (!Address.isValid(arg)) throw new ParseException("Address is not valid");
                return new Descriptor(body, Address.parse(arg).toScript(), false);
            case "pk":
            case "pkh":
                if (arg.contains("*")) {
                    return new Descriptor(body, null, true);
                }
                byte[] key = parseKey(arg);
                Script script = function.equals("pk")
                        ? Script.payToPubKey(key)
                        : Address.fromPublicKey(key).toScript();
                return new Descriptor(body, script, false);
            default:
                throw new ParseException("'" + function + "' is not a valid descriptor function");
        }
    }

    public boolean isRanged() { return ranged; }

    /** The single script this descriptor expands to. */
    public Script script() {
        if (ranged) throw new IllegalStateException("ranged descriptor has no single script");
        return script;
    }

    /** Descriptor text with its checksum appended. */
    public String withChecksum() {
        return text + "#" + checksum(text);
    }

    /** Computes the 8-character descriptor checksum, or the empty string for unsupported characters. */
    public static String checksum(String span) {
        long c = 1;
        int cls = 0;
        int clsCount = 0;
        for (int i = 0; i < span.length(); i++) {
            int pos = INPUT_CHARSET.indexOf(span.charAt(i));
            if (pos < 0) return "";
            c = polyMod(c, pos & 31);
            cls = cls * 3 + (pos >> 5);
            if (++clsCount == 3) {
                c = polyMod(c, cls);
                cls = 0;
                clsCount = 0;
            }
        }
        if (clsCount > 0) c = polyMod(c, cls);
        for (int j = 0; j < CHECKSUM_LENGTH; j++) c = polyMod(c, 0);
        c ^= 1;

        char[] out = new char[CHECKSUM_LENGTH];
        for (int j = 0; j < CHECKSUM_LENGTH; j++) {
            out[j] = CHECKSUM_CHARSET.charAt((int) ((c >>> (5 * (7 - j))) & 31));
        }
        return new String(out);
    }

    private static long polyMod(long c, int val) {
        long c0 = c >>> 35;
        c = ((c & 0x7ffffffffL) << 5) ^ val;
        for (int i = 0; i < GENERATOR.length; i++) {
            if (((c0 >>> i) & 1) != 0) c ^= GENERATOR[i];
        }
        return c;
    }

    private static byte[] parseKey(String hex) {
        if (!Hex.isHex(hex)) {
            throw new ParseException("key '" + hex + "' is not valid");
        }
        byte[] key = Hex.decode(hex);
        boolean compressed = key.length == 33 && (key[0] == 0x02 || key[0] == 0x03);
        boolean uncompressed = key.length == 65 && key[0] == 0x04;
        if (!compressed && !uncompressed) {
            throw new ParseException("key '" + hex + "' is not valid");
        }
        return key;
    }

    @Override public String toString() { return text; }
}

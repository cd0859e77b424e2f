package ai.svgtranslate.prepare;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allocates reserved {@code trsvg<N>} ids for one document pass. Numbers are handed out beyond
 * the largest number already in use.
 */
public final class IdAllocator {

    public static final String RESERVED_PREFIX = "trsvg";

    private static final Pattern RESERVED_ID = Pattern.compile("^" + RESERVED_PREFIX + "([0-9]+)$");

    private BigInteger max = BigInteger.ZERO;

    /**
     * Records an existing id. Returns {@code true} when it is a reserved id.
     */
    public boolean observe(String id) {
        if (id == null) {
            return false;
        }
        Matcher matcher = RESERVED_ID.matcher(id);
        if (!matcher.matches()) {
            return false;
        }
        max = max.max(new BigInteger(matcher.group(1)));
        return true;
    }

    public String next() {
        max = max.add(BigInteger.ONE);
        return RESERVED_PREFIX + max;
    }

    public static boolean isReserved(String id) {
        return id != null && RESERVED_ID.matcher(id).matches();
    }
}

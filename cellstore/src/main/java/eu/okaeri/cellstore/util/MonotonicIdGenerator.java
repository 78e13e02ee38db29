package eu.okaeri.cellstore.util;

import lombok.NonNull;

import java.security.SecureRandom;
import java.util.Random;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Generates version 7 UUIDs whose text form increases strictly with every call.
 * <p>
 * The 12 bit {@code rand_a} field holds a counter seeded randomly each millisecond. When the
 * counter overflows, or the clock goes backwards, the timestamp is advanced past the last
 * issued one so ordering never breaks.
 */
public class MonotonicIdGenerator {

    private static final int COUNTER_BITS = 12;
    private static final int COUNTER_MAX = (1 << COUNTER_BITS) - 1;
    private static final int COUNTER_SEED_BOUND = 1 << (COUNTER_BITS - 1);

    private final LongSupplier clock;
    private final Random random;

    private long lastMillis = -1;
    private int counter;

    public MonotonicIdGenerator() {
        this(System::currentTimeMillis, new SecureRandom());
    }

    public MonotonicIdGenerator(@NonNull LongSupplier clock, @NonNull Random random) {
        this.clock = clock;
        this.random = random;
    }

    public synchronized String next() {

        long now = this.clock.getAsLong();
        if (now > this.lastMillis) {
            this.lastMillis = now;
            this.counter = this.random.nextInt(COUNTER_SEED_BOUND);
        } else if (this.counter < COUNTER_MAX) {
            this.counter++;
        } else {
            this.lastMillis++;
            this.counter = 0;
        }

        long mostSig = (this.lastMillis << 16) | (0x7L << 12) | this.counter;
        long leastSig = (this.random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(mostSig, leastSig).toString();
    }

    /**
     * Make sure every following id sorts after {@code issued}, e.g. the greatest id
     * already stored when a cell is reopened. Ids not produced by this generator are ignored.
     */
    public synchronized void observe(String issued) {

        if (issued == null) {
            return;
        }

        UUID uuid;
        try {
            uuid = UUID.fromString(issued);
        } catch (IllegalArgumentException ignored) {
            return;
        }
        if (uuid.version() != 7) {
            return;
        }

        long millis = uuid.getMostSignificantBits() >>> 16;
        int issuedCounter = (int) (uuid.getMostSignificantBits() & COUNTER_MAX);
        if ((millis > this.lastMillis) || ((millis == this.lastMillis) && (issuedCounter > this.counter))) {
            this.lastMillis = millis;
            this.counter = issuedCounter;
        }
    }
}

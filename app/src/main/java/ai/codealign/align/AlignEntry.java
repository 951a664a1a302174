package ai.codealign.align;

import java.util.Objects;

/**
 * A token queued on an {@link AlignStack} together with the sequence number it was added at.
 */
record AlignEntry<T extends AlignToken>(T token, int seqnum) {

    AlignEntry {
        Objects.requireNonNull(token, "token");
    }
}

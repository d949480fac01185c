package co.fanki.reexportmap.analysis.domain;

import java.util.Comparator;

/**
 * Orders dotted module paths segment by segment.
 *
 * <p>{@code a.b} sorts before {@code a.b.c} and before {@code a_b}, which a
 * plain string comparison would not guarantee since {@code '.'} and
 * {@code '_'} compare by code point.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModulePathOrder implements Comparator<String> {

    /** Shared instance, the comparator is stateless. */
    public static final ModulePathOrder INSTANCE = new ModulePathOrder();

    private ModulePathOrder() {
    }

    /** {@inheritDoc} */
    @Override
    public int compare(final String left, final String right) {
        final String[] leftParts = left.split("\\.");
        final String[] rightParts = right.split("\\.");
        final int common = Math.min(leftParts.length, rightParts.length);
        for (int i = 0; i < common; i++) {
            final int result = leftParts[i].compareTo(rightParts[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(leftParts.length, rightParts.length);
    }

}

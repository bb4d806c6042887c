package nl.nfi.djwordlist.generate.mask;

import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.expand.VariantExpander;
import nl.nfi.djwordlist.generate.expand.Variants;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Substitutes the placeholders of every mask with the cross product of their value sets, one base string
 * at a time. Masks are visited in configured order; within a mask the last slot varies fastest.
 * <p>
 * Only the placeholders a mask actually uses are looked up. A mask with a placeholder whose value set is
 * empty yields nothing for that base string.
 */
public final class MaskComposer {

    private final List<Mask> masks;
    private final VariantExpander expander;
    private final List<String> numbers;
    private final List<String> symbols;
    private final List<String> years;

    private MaskComposer(final List<Mask> masks, final VariantExpander expander, final List<String> numbers, final List<String> symbols, final List<String> years) {
        this.masks = masks;
        this.expander = expander;
        this.numbers = numbers;
        this.symbols = symbols;
        this.years = years;
    }

    public static MaskComposer of(final List<Mask> masks, final VariantExpander expander, final List<String> numbers, final List<String> symbols, final List<String> years) {
        return new MaskComposer(masks, expander, numbers, symbols, years);
    }

    public static MaskComposer forConfig(final GeneratorConfig config) {
        return of(config.masks(), VariantExpander.forConfig(config), config.numbers(), config.symbols(), config.years());
    }

    public Iterator<String> candidates(final String base) {
        return new BaseCandidateIterator(expander.expand(base));
    }

    private Iterable<String> valuesFor(final Placeholder placeholder, final Variants variants) {
        return switch (placeholder) {
            case BASE -> variants.base();
            case CAPITALIZED -> List.of(variants.capitalized());
            case UPPER -> List.of(variants.upper());
            case CAMEL -> List.of(variants.camel());
            case NUMBER -> numbers;
            case SYMBOL -> symbols;
            case YEAR -> years;
        };
    }

    private final class BaseCandidateIterator implements Iterator<String> {

        private final Variants variants;
        private int maskIndex = -1;
        private CrossProduct product;

        private BaseCandidateIterator(final Variants variants) {
            this.variants = variants;
            nextMask();
        }

        @Override
        public boolean hasNext() {
            return product != null;
        }

        @Override
        public String next() {
            if (product == null) {
                throw new NoSuchElementException();
            }
            final String candidate = product.render();
            if (!product.advance()) {
                nextMask();
            }
            return candidate;
        }

        private void nextMask() {
            product = null;
            while (product == null && ++maskIndex < masks.size()) {
                final Mask mask = masks.get(maskIndex);
                final List<Iterable<String>> sources = new ArrayList<>(mask.slots().size());
                for (final Placeholder placeholder : mask.slots()) {
                    sources.add(valuesFor(placeholder, variants));
                }
                product = CrossProduct.start(mask, sources);
            }
        }
    }

    // odometer over one iterator per slot, restarting exhausted slots from their source
    private static final class CrossProduct {

        private final Mask mask;
        private final List<Iterable<String>> sources;
        private final List<Iterator<String>> iterators;
        private final String[] values;

        private CrossProduct(final Mask mask, final List<Iterable<String>> sources, final List<Iterator<String>> iterators, final String[] values) {
            this.mask = mask;
            this.sources = sources;
            this.iterators = iterators;
            this.values = values;
        }

        // null when some slot has no values at all
        static CrossProduct start(final Mask mask, final List<Iterable<String>> sources) {
            final List<Iterator<String>> iterators = new ArrayList<>(sources.size());
            final String[] values = new String[sources.size()];
            for (int slot = 0; slot < sources.size(); slot++) {
                final Iterator<String> iterator = sources.get(slot).iterator();
                if (!iterator.hasNext()) {
                    return null;
                }
                values[slot] = iterator.next();
                iterators.add(iterator);
            }
            return new CrossProduct(mask, sources, iterators, values);
        }

        String render() {
            return mask.render(values);
        }

        boolean advance() {
            for (int slot = sources.size() - 1; slot >= 0; slot--) {
                if (iterators.get(slot).hasNext()) {
                    values[slot] = iterators.get(slot).next();
                    return true;
                }
                final Iterator<String> restarted = sources.get(slot).iterator();
                values[slot] = restarted.next();
                iterators.set(slot, restarted);
            }
            return false;
        }
    }
}

package nl.nfi.djwordlist.generate.expand;

/**
 * The variants of one base string, one value (or value set) per variant placeholder kind.
 *
 * @param base        case and leet variants, enumerated lazily and restartable
 * @param capitalized the base string with its first character upper cased
 * @param upper       the base string fully upper cased
 * @param camel       the base string camel cased
 */
public record Variants(Iterable<String> base, String capitalized, String upper, String camel) {

}

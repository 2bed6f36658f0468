package uisnap.traversal;

import uisnap.provider.NodeProvider;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One source of text for a node. The walker evaluates a list of these in order and keeps
 * every non-blank result.
 *
 * @param <H> node handle type
 */
@FunctionalInterface
public interface TextExtractor<H> {

    /** Returns the text this extractor finds on {@code node}, or null. */
    String extract(NodeProvider<H> provider, H node);

    /** Extractor reading a single named string attribute. */
    static <H> TextExtractor<H> attribute(String name) {
        return (provider, node) -> provider.stringAttribute(node, name);
    }

    /** One attribute extractor per name, in the given order. */
    static <H> List<TextExtractor<H>> attributes(List<String> names) {
        return names.stream().map(TextExtractor::<H>attribute).collect(Collectors.toList());
    }
}

package com.example.acfeed;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A structural path through a document, kept as data: an ordered list of {@link Step}s joined by
 * descendant or child relations. Evaluated with jsoup by rendering the path as a CSS selector.
 *
 * <pre>{@code
 * NodeQuery.of(NodeQuery.tag("table").classes("prod-list-features"))
 *          .descendant(NodeQuery.tag("tbody"))
 * }</pre>
 */
public final class NodeQuery {

    public enum Relation {
        DESCENDANT(" "),
        CHILD(" > ");

        private final String combinator;

        Relation(String combinator) {
            this.combinator = combinator;
        }
    }

    /**
     * Matches one element by tag name, id, attribute values and class membership. Every condition
     * set on the step must hold.
     */
    public static final class Step {
        private final String tag;
        private String id;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<String> classes = new ArrayList<>();

        private Step(String tag) {
            this.tag = tag;
        }

        public Step id(String id) {
            this.id = id;
            return this;
        }

        public Step attr(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Step classes(String... names) {
            classes.addAll(Arrays.asList(names));
            return this;
        }

        String toCss() {
            StringBuilder sb = new StringBuilder(tag);
            if (id != null) sb.append('#').append(id);
            for (String c : classes) sb.append('.').append(c);
            attributes.forEach((k, v) -> sb.append('[').append(k).append("=\"").append(v).append("\"]"));
            return sb.toString();
        }
    }

    private final Relation leading;
    private final List<Step> steps;
    private final List<Relation> relations;
    private final String css;

    private NodeQuery(Relation leading, List<Step> steps, List<Relation> relations) {
        this.leading = leading;
        this.steps = steps;
        this.relations = relations;
        this.css = render();
    }

    public static Step tag(String name) {
        return new Step(name);
    }

    /** Query that starts anywhere below (or at) the element it is evaluated on. */
    public static NodeQuery of(Step first) {
        return new NodeQuery(Relation.DESCENDANT, List.of(first), List.of());
    }

    /** Query that starts at the direct children of the element it is evaluated on. */
    public static NodeQuery childrenOf(Step first) {
        return new NodeQuery(Relation.CHILD, List.of(first), List.of());
    }

    public NodeQuery descendant(Step next) {
        return then(Relation.DESCENDANT, next);
    }

    public NodeQuery child(Step next) {
        return then(Relation.CHILD, next);
    }

    private NodeQuery then(Relation relation, Step next) {
        List<Step> s = new ArrayList<>(steps);
        s.add(next);
        List<Relation> r = new ArrayList<>(relations);
        r.add(relation);
        return new NodeQuery(leading, Collections.unmodifiableList(s), Collections.unmodifiableList(r));
    }

    /** First match in document order, or empty when nothing matches. */
    public Optional<Element> first(Element root) {
        return Optional.ofNullable(root.selectFirst(css));
    }

    /** All matches in document order. */
    public List<Element> all(Element root) {
        return root.select(css);
    }

    public String toCss() {
        return css;
    }

    private String render() {
        StringBuilder sb = new StringBuilder();
        if (leading == Relation.CHILD) sb.append("> ");
        sb.append(steps.get(0).toCss());
        for (int i = 1; i < steps.size(); i++) {
            sb.append(relations.get(i - 1).combinator).append(steps.get(i).toCss());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return css;
    }
}

package com.smarts.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarts.ast.Bond;
import com.smarts.ast.BondedAtom;
import com.smarts.ast.Branch;
import com.smarts.ast.BranchType;
import com.smarts.ast.ExplicitAnd;
import com.smarts.ast.Expression;
import com.smarts.ast.ImplicitAnd;
import com.smarts.ast.Negation;
import com.smarts.ast.OrClause;
import com.smarts.ast.PrimitiveAtom;
import com.smarts.ast.SmartsPattern;
import com.smarts.ast.SpecificAtom;
import com.smarts.ast.Specification;
import com.smarts.exception.SmartsException;

import java.util.function.BiConsumer;

/**
 * Renders parsed patterns as JSON for consumers outside the JVM.
 * <p>
 * Every object has a {@code type}; expressions nest
 * {@code clauses -> alternatives -> terms -> leaves}.
 */
public class SmartsJsonWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Render a pattern as a JSON tree.
     */
    public JsonNode toTree(SmartsPattern pattern) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "pattern");
        ArrayNode branches = node.putArray("branches");
        for (Branch branch : pattern.branches()) {
            branches.add(branch(branch));
        }
        return node;
    }

    /**
     * Render a pattern as a JSON string.
     *
     * @param pretty Whether to indent the output
     */
    public String toJson(SmartsPattern pattern, boolean pretty) {
        try {
            JsonNode tree = toTree(pattern);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new SmartsException("Failed to render SMARTS pattern as JSON: " + e.getMessage(), e);
        }
    }

    private ObjectNode branch(Branch branch) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", branch.type().name().toLowerCase());
        ArrayNode atoms = node.putArray("component");
        for (BondedAtom bondedAtom : branch.component().atoms()) {
            ObjectNode entry = atoms.addObject();
            entry.set("bond", expression(bondedAtom.bond(), this::bond));
            entry.set("atom", specificAtom(bondedAtom.atom()));
        }
        if (branch.type() == BranchType.COMPOUND) {
            ArrayNode nested = node.putArray("branches");
            for (Branch child : branch.branches()) {
                nested.add(branch(child));
            }
        }
        return node;
    }

    private ObjectNode specificAtom(SpecificAtom atom) {
        ObjectNode node;
        if (atom.isPrimitive()) {
            node = primitive(atom.primitive());
        } else {
            node = objectMapper.createObjectNode();
            node.put("type", "description");
            node.set("expression", expression(atom.description(), this::specification));
        }
        ArrayNode closures = node.putArray("ringClosures");
        for (int closure : atom.ringClosures()) {
            closures.add(closure);
        }
        return node;
    }

    private ObjectNode primitive(PrimitiveAtom atom) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", atom.type().name().toLowerCase());
        if (atom.symbol() != null) {
            node.put("symbol", atom.symbol());
        }
        return node;
    }

    private <L> ObjectNode expression(Expression<L> expression, BiConsumer<L, ObjectNode> leafWriter) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "expression");
        ArrayNode clauses = node.putArray("clauses");
        for (OrClause<L> clause : expression.clauses()) {
            ArrayNode alternatives = clauses.addObject().putArray("alternatives");
            for (ExplicitAnd<L> alternative : clause.alternatives()) {
                ArrayNode terms = alternatives.addObject().putArray("terms");
                for (ImplicitAnd<L> term : alternative.terms()) {
                    ArrayNode leaves = terms.addObject().putArray("leaves");
                    for (L leaf : term.leaves()) {
                        leafWriter.accept(leaf, leaves.addObject());
                    }
                }
            }
        }
        return node;
    }

    private void bond(Bond bond, ObjectNode node) {
        node.put("type", bond.type().name().toLowerCase());
        node.put("negated", bond.negation() == Negation.NEGATE);
        if (bond.presence() != null) {
            node.put("presence", bond.presence().name().toLowerCase());
        }
    }

    private void specification(Specification specification, ObjectNode node) {
        node.put("type", specification.type().name().toLowerCase());
        if (specification.negation() != null) {
            node.put("negated", specification.negation() == Negation.NEGATE);
        }
        if (specification.value() != null) {
            node.put("value", specification.value());
        }
        if (specification.atom() != null) {
            node.set("atom", primitive(specification.atom()));
        }
        if (specification.chiralityClass() != null) {
            node.put("class", specification.chiralityClass().code());
        }
        if (specification.presence() != null) {
            node.put("presence", specification.presence().name().toLowerCase());
        }
        if (specification.pattern() != null) {
            node.set("pattern", toTree(specification.pattern()));
        }
    }
}

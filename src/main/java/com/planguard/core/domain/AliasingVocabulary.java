package com.planguard.core.domain;

import com.planguard.core.plan.ActionNode;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vocabulary whose actions are described by {@link ActionSignature}s.
 *
 * Argument resolution:
 *   1. each slot takes its first alias key with a non-blank value
 *   2. slots still empty take, in slot order, the parameters no alias
 *      consumed (insertion order of the map)
 * A slot left empty after both rules fails the whole grounding. A value
 * taken by an alias is never reused positionally.
 */
abstract class AliasingVocabulary implements ActionVocabulary {

    private final Map<String, ActionSignature> signatures = new LinkedHashMap<>();

    protected void register(ActionSignature signature) {
        signatures.put(signature.getName(), signature);
    }

    @Override
    public List<ActionSignature> signatures() {
        return List.copyOf(signatures.values());
    }

    @Override
    public Optional<ActionSignature> signature(String canonicalName) {
        return Optional.ofNullable(signatures.get(canonicalName));
    }

    @Override
    public Optional<GroundAction> ground(ActionNode node) {
        Optional<String> name = canonicalName(node.getActionType());
        if (name.isEmpty()) return Optional.empty();

        ActionSignature sig = signatures.get(name.get());
        Map<String, String> params = node.getParams();

        Set<String> consumed = new HashSet<>();
        String[] args = new String[sig.arity()];
        for (int i = 0; i < sig.arity(); i++) {
            Optional<String> key = aliasKey(params, sig.getSlots().get(i).getAliases(), consumed);
            if (key.isPresent()) {
                consumed.add(key.get());
                args[i] = normalizeValue(params.get(key.get()));
            }
        }

        Iterator<String> leftovers = params.entrySet().stream()
                .filter(e -> !consumed.contains(e.getKey()))
                .map(e -> normalizeValue(e.getValue()))
                .filter(v -> !v.isEmpty())
                .iterator();
        for (int i = 0; i < args.length; i++) {
            if (args[i] == null) {
                if (!leftovers.hasNext()) return Optional.empty();
                args[i] = leftovers.next();
            }
        }
        return Optional.of(new GroundAction(sig.getName(), List.of(args)));
    }

    private static Optional<String> aliasKey(Map<String, String> params, List<String> aliases, Set<String> consumed) {
        for (String key : aliases) {
            if (!consumed.contains(key) && !normalizeValue(params.get(key)).isEmpty()) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    /** Lower-cases and strips the "block " prefix models like to add. */
    static String normalizeValue(String raw) {
        if (raw == null) return "";
        String s = raw.toLowerCase(Locale.ROOT).trim();
        if (s.startsWith("block ")) s = s.substring(6).trim();
        return s;
    }

    /** "Pick_Up", "pick-up", "PICKUP" all become "pickup". */
    static String squash(String actionType) {
        if (actionType == null) return "";
        return actionType.toLowerCase(Locale.ROOT)
                .replace("-", "")
                .replace("_", "")
                .replace(" ", "")
                .trim();
    }
}

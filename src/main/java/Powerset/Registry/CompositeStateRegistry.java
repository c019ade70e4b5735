package Powerset.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Discovery ledger of the subset construction.
 * <p>
 * Composite states are keyed by value (BitSet equality), so rediscovering a set resolves to the id and name
 * it received the first time. Ids are dense and follow discovery order.
 */
public class CompositeStateRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> key2Id;
    private final List<BitSet> members;
    private final List<String> names;
    private final StateNamer namer;

    public CompositeStateRegistry(StateNamer namer) {
        this.key2Id = new Object2IntOpenHashMap<>();
        this.key2Id.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.members = new ArrayList<>();
        this.names = new ArrayList<>();
        this.namer = namer;
    }

    /**
     * @param composite - set of NFA state ids
     * @return id of the composite state, or MISSING_ELEMENT if not yet discovered
     */
    public int get(BitSet composite) {
        return key2Id.getInt(composite);
    }

    /**
     * Register a newly discovered composite state and name it.
     * @param composite - non-empty set of NFA state ids; copied, so the caller may reuse it
     * @return the new id
     */
    public int put(BitSet composite) {
        if (composite.isEmpty()) {
            throw new IllegalArgumentException("Empty composite state");
        }
        if (key2Id.containsKey(composite)) {
            throw new IllegalArgumentException("Composite state already registered: " + composite);
        }
        int id = members.size();
        BitSet key = (BitSet) composite.clone();
        key2Id.put(key, id);
        members.add(key);
        names.add(namer.name(id));
        return id;
    }

    public String getName(int id) {
        return names.get(id);
    }

    /**
     * Members of a registered composite state. The returned set must not be modified.
     */
    public BitSet getMembers(int id) {
        return members.get(id);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "Registry[" + size() + " composite states, names " + namer + "]";
    }
}

package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.Ext;
import io.github.eutro.livevars.core.ext.ExtHolder;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function, a list of {@link BasicBlock basic blocks} forming one control flow graph.
 */
public final class Function extends ExtHolder {
    /**
     * The list of basic blocks in this function. The first element is the entry block.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    };

    /**
     * Whether variables with the same name should be numbered apart.
     * Only affects how variables print.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("LIVEVARS_UNIQUE_VAR_NAMES") != null;

    private final Map<String, Integer> varCounters = new HashMap<>();

    /**
     * Create a new variable with the given name.
     *
     * @param name The name.
     * @return The new variable.
     */
    public Var newVar(String name) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, 0);
        }
        int index = varCounters.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    /**
     * Create a new basic block at the end of this function.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    /**
     * Get the entry block of this function.
     *
     * @return The entry block.
     * @throws MalformedIRException If the function has no blocks.
     */
    public BasicBlock getEntry() {
        if (blocks.isEmpty()) {
            throw new MalformedIRException("function has no entry block");
        }
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}

package pass;

import translate.SymbolTable;

public interface Pass {
    // just a mark class

    /**
     * Rewrites the block graph held by a {@link SymbolTable}. Each pass
     * runs to its own fixpoint.
     */
    public interface StructuringPass extends Pass {
        StructuringPassType getType();

        /**
         * @return true if the block graph changed
         */
        boolean run(SymbolTable symbols);
    }
}

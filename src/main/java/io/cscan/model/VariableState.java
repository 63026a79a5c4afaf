package io.cscan.model;

/**
 * One binding of a C identifier within a scope instance.
 * <p>
 * The declaration facts (name, type, scope) are fixed at construction; the tracked state
 * (initialization, symbolic value, last known constant) changes as the file is scanned.
 * A FREED binding is always initialized.
 */
public final class VariableState {

    private final String name;
    private final String baseType;
    private final int pointerDepth;
    private final boolean array;
    private final boolean aggregate;
    private final boolean isStatic;
    private final boolean parameter;
    private final int declLine;
    private final int scopeDepth;
    private final int functionIndex;

    private boolean initialized;
    private SymbolicValue symbolicValue;
    private int lastAssignLine;
    private int allocLine;
    private int freedLine;
    private int writes;
    private VariableState aliasOf;
    private int aliasWrites;
    private Long constantValue;
    private NullGuard nullGuard;
    private boolean escaped;
    private boolean addressTaken;
    private boolean outOfScope;

    private VariableState(Builder b) {
        this.name = b.name;
        this.baseType = b.baseType;
        this.pointerDepth = b.pointerDepth;
        this.array = b.array;
        this.aggregate = b.aggregate;
        this.isStatic = b.isStatic;
        this.parameter = b.parameter;
        this.declLine = b.declLine;
        this.scopeDepth = b.scopeDepth;
        this.functionIndex = b.functionIndex;
        this.initialized = b.initialized;
        this.symbolicValue = b.symbolicValue;
        this.lastAssignLine = b.initialized ? b.declLine : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String baseType = "int";
        private int pointerDepth;
        private boolean array;
        private boolean aggregate;
        private boolean isStatic;
        private boolean parameter;
        private int declLine;
        private int scopeDepth;
        private int functionIndex;
        private boolean initialized;
        private SymbolicValue symbolicValue = SymbolicValue.UNKNOWN;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseType(String baseType) {
            this.baseType = baseType;
            return this;
        }

        public Builder pointerDepth(int pointerDepth) {
            this.pointerDepth = pointerDepth;
            return this;
        }

        public Builder array(boolean array) {
            this.array = array;
            return this;
        }

        public Builder aggregate(boolean aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder isStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder parameter(boolean parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder declLine(int declLine) {
            this.declLine = declLine;
            return this;
        }

        public Builder scopeDepth(int scopeDepth) {
            this.scopeDepth = scopeDepth;
            return this;
        }

        public Builder functionIndex(int functionIndex) {
            this.functionIndex = functionIndex;
            return this;
        }

        public Builder initialized(boolean initialized) {
            this.initialized = initialized;
            return this;
        }

        public Builder symbolicValue(SymbolicValue symbolicValue) {
            this.symbolicValue = symbolicValue;
            return this;
        }

        public VariableState build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (symbolicValue == SymbolicValue.FREED) {
                initialized = true;
            }
            return new VariableState(this);
        }
    }

    // --- state transitions ---

    /**
     * Records a write of some value that is not otherwise tracked.
     */
    public void markAssigned(int line, SymbolicValue value) {
        this.initialized = true;
        this.symbolicValue = value;
        this.lastAssignLine = line;
        this.writes++;
        this.aliasOf = null;
        this.nullGuard = null;
        this.constantValue = null;
    }

    public void markAllocated(int line) {
        markAssigned(line, SymbolicValue.ALLOCATED);
        this.allocLine = line;
        this.escaped = false;
    }

    public void markNull(int line) {
        markAssigned(line, SymbolicValue.NULL);
    }

    public void markFreed(int line) {
        this.initialized = true;
        this.symbolicValue = SymbolicValue.FREED;
        this.freedLine = line;
    }

    /**
     * Records an integer literal write, keeping the value for loop analysis.
     */
    public void markConstant(int line, long value) {
        markAssigned(line, SymbolicValue.OTHER_EXPR);
        this.constantValue = value;
    }

    /**
     * Copies another pointer's tracked state into this one and links the two.
     * The link lasts until either side is written again.
     */
    public void copyFrom(VariableState source, int line) {
        markAssigned(line, source.symbolicValue);
        this.initialized = source.initialized;
        this.allocLine = source.allocLine;
        this.freedLine = source.freedLine;
        this.aliasOf = source;
        this.aliasWrites = source.writes;
    }

    /**
     * Marks an address-of use ({@code &x}): the callee may write through it.
     */
    public void markAddressTaken() {
        this.addressTaken = true;
        this.initialized = true;
        this.constantValue = null;
    }

    public void clearConstant() {
        this.constantValue = null;
    }

    public void setNullGuard(NullGuard nullGuard) {
        this.nullGuard = nullGuard;
    }

    /**
     * Ends the null guard once its branch is over.
     */
    public void endLine(int line, int minDepth, int endDepth) {
        if (nullGuard != null && !nullGuard.endLine(line, minDepth, endDepth)) {
            nullGuard = null;
        }
    }

    public void setEscaped(boolean escaped) {
        this.escaped = escaped;
    }

    public void setOutOfScope(boolean outOfScope) {
        this.outOfScope = outOfScope;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    // --- accessors ---

    public String name() {
        return name;
    }

    public String baseType() {
        return baseType;
    }

    public int pointerDepth() {
        return pointerDepth;
    }

    public boolean isPointer() {
        return pointerDepth > 0;
    }

    public boolean isArray() {
        return array;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isParameter() {
        return parameter;
    }

    /**
     * Returns true for float and double scalars (not pointers to them).
     */
    public boolean isFloating() {
        return pointerDepth == 0 && !array && (baseType.endsWith("float") || baseType.endsWith("double"));
    }

    public int declLine() {
        return declLine;
    }

    public int scopeDepth() {
        return scopeDepth;
    }

    public int functionIndex() {
        return functionIndex;
    }

    public boolean initialized() {
        return initialized;
    }

    public SymbolicValue symbolicValue() {
        return symbolicValue;
    }

    public int lastAssignLine() {
        return lastAssignLine;
    }

    public int allocLine() {
        return allocLine;
    }

    public int freedLine() {
        return freedLine;
    }

    /**
     * The pointer this one was copied from, while neither has been written since.
     */
    public VariableState aliasOf() {
        return aliasOf != null && aliasOf.writes == aliasWrites ? aliasOf : null;
    }

    public Long constantValue() {
        return constantValue;
    }

    public boolean isNullGuardedAt(int line, int depth) {
        return nullGuard != null && nullGuard.covers(line, depth);
    }

    public boolean escaped() {
        return escaped;
    }

    public boolean addressTaken() {
        return addressTaken;
    }

    public boolean outOfScope() {
        return outOfScope;
    }

    @Override
    public String toString() {
        return "VariableState[" + name + ", " + baseType + "*".repeat(pointerDepth)
                + ", line " + declLine + ", depth " + scopeDepth
                + ", " + symbolicValue + (initialized ? "" : ", uninitialized") + "]";
    }
}

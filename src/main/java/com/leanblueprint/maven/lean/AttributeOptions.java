package com.leanblueprint.maven.lean;

/**
 * Which optional parts of a node go into its {@code @[blueprint]} attribute.
 */
public final class AttributeOptions {

    public static final AttributeOptions ALL = new AttributeOptions(true, true, true, true, true, true);

    private final boolean statementText;
    private final boolean uses;
    private final boolean usesRaw;
    private final boolean proofText;
    private final boolean proofUses;
    private final boolean proofUsesRaw;

    public AttributeOptions(boolean statementText, boolean uses, boolean usesRaw,
            boolean proofText, boolean proofUses, boolean proofUsesRaw) {
        this.statementText = statementText;
        this.uses = uses;
        this.usesRaw = usesRaw;
        this.proofText = proofText;
        this.proofUses = proofUses;
        this.proofUsesRaw = proofUsesRaw;
    }

    public boolean isStatementText() {
        return statementText;
    }

    public boolean isUses() {
        return uses;
    }

    public boolean isUsesRaw() {
        return usesRaw;
    }

    public boolean isProofText() {
        return proofText;
    }

    public boolean isProofUses() {
        return proofUses;
    }

    public boolean isProofUsesRaw() {
        return proofUsesRaw;
    }

    @Override
    public String toString() {
        return "AttributeOptions{statementText=" + statementText + ", uses=" + uses + ", usesRaw=" + usesRaw
                + ", proofText=" + proofText + ", proofUses=" + proofUses + ", proofUsesRaw=" + proofUsesRaw + "}";
    }
}

package com.questrail.evgen.interaction;

import java.util.Objects;

/**
 * Probe identity, probe four-momentum and {@link Target}: the input contract
 * to every interaction list generator.
 * <p>
 * The state owns its target; the copy constructor copies it.
 */
public final class InitialState
{
    private final int probeCode;
    private final Target target;
    private LorentzVector probeP4;

    public InitialState(int probeCode, Target target) {
        this(probeCode, target, LorentzVector.ZERO);
    }

    public InitialState(int probeCode, Target target, LorentzVector probeP4) {
        this.probeCode = probeCode;
        this.target = new Target(Objects.requireNonNull(target, "target"));
        this.probeP4 = Objects.requireNonNull(probeP4, "probeP4");
    }

    public InitialState(InitialState other) {
        this(Objects.requireNonNull(other, "other").probeCode, other.target, other.probeP4);
    }

    public int probeCode() {
        return probeCode;
    }

    /**
     * Returns the owned target. Mutations through this reference change this
     * state; generators rely on that to assign the struck nucleon.
     */
    public Target target() {
        return target;
    }

    public LorentzVector probeP4() {
        return probeP4;
    }

    public void setProbeP4(LorentzVector probeP4) {
        this.probeP4 = Objects.requireNonNull(probeP4, "probeP4");
    }

    public String asString() {
        return "nu:" + probeCode + ";tgt:" + target.asString();
    }

    @Override
    public String toString() {
        return "InitialState[" + asString() + ", probeP4=" + probeP4.asString() + "]";
    }
}

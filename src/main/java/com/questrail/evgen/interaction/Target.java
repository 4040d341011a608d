package com.questrail.evgen.interaction;

import com.questrail.evgen.pdg.ParticleProperties;
import com.questrail.evgen.pdg.PdgCodes;
import com.questrail.evgen.pdg.PdgTables;
import com.questrail.evgen.pdg.PdgUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Target
 * -----------------------------------------------------------------------------
 * The object a probe interacts with. A single type covers quite different
 * physical systems:
 * <ul>
 *   <li>a free particle (e.g. an electron in inverse muon decay), {@code Z = A = 0}</li>
 *   <li>a free nucleon, {@code A = 1} and {@code Z} in {0, 1}</li>
 *   <li>a bound nucleus, {@code A > 1}</li>
 * </ul>
 * optionally refined by a struck-nucleon sub-state (which nucleon, with its
 * four-momentum) and a struck-quark sub-state (which quark, valence or sea).
 *
 * <h2>Validity</h2>
 * {@code (Z, A)} is valid iff the target is a free nucleon or the nucleus is in
 * the {@link com.questrail.evgen.pdg.IsotopeTable}. Setting an invalid pair
 * resets both to 0 and logs a warning. Setting a struck nucleon that is not a
 * proton or neutron resets it to unset. Setting a struck quark that is not a
 * quark or antiquark is ignored. None of these throw; callers check
 * {@link #isValidNucleus()} / {@link #struckNucleonIsSet()} before relying on
 * the state.
 *
 * <h2>Side effects</h2>
 * <ul>
 *   <li>{@link #setZA(int, int)} on a free nucleon also sets the struck nucleon</li>
 *   <li>{@link #setStruckNucleonCode(int)} resets the struck-nucleon four-momentum
 *       to the on-shell rest value; callers wanting a moving nucleon call
 *       {@link #setStruckNucleonFourMomentum(LorentzVector)} afterwards</li>
 * </ul>
 *
 * Instances are mutable and not thread-safe. Use the copy constructor to hand
 * an independent target to another owner.
 */
public final class Target
{
    private static final Logger log = LoggerFactory.getLogger(Target.class);

    private final PdgTables tables;

    private int targetCode;
    private int z;
    private int a;
    private int struckNucleonCode;
    private int struckQuarkCode;
    private boolean seaQuark;
    private LorentzVector struckNucleonP4;

    /**
     * Creates an unset target (identity code 0, {@code Z = A = 0}).
     */
    public Target(PdgTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.struckNucleonP4 = LorentzVector.atRest(PdgCodes.NUCLEON_MASS);
    }

    /**
     * Creates a target from an identity code. Ion codes are decoded into
     * {@code (Z, A)}; any other code describes a free particle.
     */
    public Target(PdgTables tables, int code) {
        this(tables);
        this.targetCode = code;
        if (PdgUtils.isIon(code)) {
            setZA(PdgUtils.ionPdgCodeToZ(code), PdgUtils.ionPdgCodeToA(code));
        }
    }

    public Target(PdgTables tables, int z, int a) {
        this(tables);
        this.targetCode = PdgUtils.ionPdgCode(a, z);
        setZA(z, a);
    }

    /**
     * Creates a nuclear target with an explicit struck nucleon. The free-nucleon
     * auto-derivation is skipped; the given struck nucleon wins.
     */
    public Target(PdgTables tables, int z, int a, int struckNucleonCode) {
        this(tables);
        this.targetCode = PdgUtils.ionPdgCode(a, z);
        this.z = z;
        this.a = a;
        forceNucleusValidity();
        setStruckNucleonCode(struckNucleonCode);
    }

    /**
     * Copy constructor.
     */
    public Target(Target other) {
        Objects.requireNonNull(other, "other");
        this.tables = other.tables;
        this.targetCode = other.targetCode;
        this.z = other.z;
        this.a = other.a;
        this.struckNucleonCode = other.struckNucleonCode;
        this.struckQuarkCode = other.struckQuarkCode;
        this.seaQuark = other.seaQuark;
        this.struckNucleonP4 = other.struckNucleonP4;
    }

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    public int z() {
        return z;
    }

    public int n() {
        return a - z;
    }

    public int a() {
        return a;
    }

    public int pdgCode() {
        return targetCode;
    }

    /**
     * Mass in GeV from the particle table, {@code 0} if the identity is unknown.
     */
    public double mass() {
        return tables.particles().massOf(targetCode);
    }

    /**
     * Charge in units of +e from the particle table, {@code 0} if unknown.
     */
    public double charge() {
        return tables.particles().find(targetCode)
                .map(ParticleProperties::charge)
                .orElse(0.0);
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    public boolean isFreeNucleon() {
        return a == 1 && (z == 0 || z == 1);
    }

    public boolean isProton() {
        return a == 1 && z == 1;
    }

    public boolean isNeutron() {
        return a == 1 && z == 0;
    }

    /**
     * {@code A > 1}. Validity was enforced when {@code (Z, A)} was set.
     */
    public boolean isNucleus() {
        return a > 1;
    }

    public boolean isParticle() {
        return a == 0 && z == 0 && tables.particles().find(targetCode).isPresent();
    }

    public boolean isValidNucleus() {
        if (isFreeNucleon()) {
            return true;
        }
        return tables.isotopes().contains(z, a);
    }

    public boolean isEvenEven() {
        return isNucleus() && n() % 2 == 0 && z % 2 == 0;
    }

    public boolean isOddOdd() {
        return isNucleus() && n() % 2 == 1 && z % 2 == 1;
    }

    public boolean isEvenOdd() {
        return isNucleus() && !isEvenEven() && !isOddOdd();
    }

    // ---------------------------------------------------------------------
    // Struck nucleon / quark
    // ---------------------------------------------------------------------

    public boolean struckNucleonIsSet() {
        return PdgUtils.isNeutronOrProton(struckNucleonCode);
    }

    public boolean struckQuarkIsSet() {
        return PdgUtils.isQuark(struckQuarkCode) || PdgUtils.isAntiQuark(struckQuarkCode);
    }

    public boolean struckQuarkIsFromSea() {
        return seaQuark;
    }

    public int struckNucleonCode() {
        return struckNucleonCode;
    }

    public int struckQuarkCode() {
        return struckQuarkCode;
    }

    public LorentzVector struckNucleonFourMomentum() {
        return struckNucleonP4;
    }

    /**
     * Table mass of the struck nucleon, or {@code 0} (with a warning) when no
     * struck nucleon is set.
     */
    public double struckNucleonMass() {
        if (!struckNucleonIsSet()) {
            log.warn("Returning struck nucleon mass = 0");
            return 0;
        }
        return tables.particles().massOf(struckNucleonCode);
    }

    // ---------------------------------------------------------------------
    // Mutators
    // ---------------------------------------------------------------------

    /**
     * Stores {@code (Z, A)}, resets both to 0 if they are not a valid nucleus,
     * and on a free nucleon sets the struck nucleon to match.
     */
    public void setZA(int z, int a) {
        this.z = z;
        this.a = a;

        forceNucleusValidity();

        if (isFreeNucleon()) {
            setStruckNucleonCode(isProton() ? PdgCodes.PROTON : PdgCodes.NEUTRON);
        }
    }

    /**
     * Sets the struck nucleon. A code other than proton/neutron clears it.
     * A valid code puts the nucleon at rest on its mass shell.
     */
    public void setStruckNucleonCode(int code) {
        this.struckNucleonCode = code;
        if (forceStruckNucleonValidity()) {
            this.struckNucleonP4 = LorentzVector.atRest(tables.particles().massOf(code));
        }
    }

    /**
     * Sets the struck quark; ignored unless {@code code} is a quark or antiquark.
     */
    public void setStruckQuarkCode(int code) {
        if (PdgUtils.isQuark(code) || PdgUtils.isAntiQuark(code)) {
            this.struckQuarkCode = code;
        }
    }

    public void setStruckNucleonFourMomentum(LorentzVector p4) {
        this.struckNucleonP4 = Objects.requireNonNull(p4, "p4");
    }

    public void setStruckSeaQuark(boolean sea) {
        this.seaQuark = sea;
    }

    private boolean forceStruckNucleonValidity() {
        boolean valid = PdgUtils.isNeutronOrProton(struckNucleonCode);
        if (!valid) {
            log.debug("Resetting struck nucleon to unset (was {})", struckNucleonCode);
            struckNucleonCode = PdgCodes.ROOTINO;
        }
        return valid;
    }

    private void forceNucleusValidity() {
        if (!isValidNucleus()) {
            log.warn("Invalid target (Z = {}, A = {}) -- resetting to Z = 0, A = 0", z, a);
            z = 0;
            a = 0;
        }
    }

    // ---------------------------------------------------------------------
    // Text forms
    // ---------------------------------------------------------------------

    /**
     * Canonical form: the identity code, then {@code [N=<code>]} when a struck
     * nucleon is set, then {@code [q=<code>(v)]} or {@code [q=<code>(s)]} when a
     * struck quark is set.
     */
    public String asString() {
        StringBuilder s = new StringBuilder();
        s.append(targetCode);
        if (struckNucleonIsSet()) {
            s.append("[N=").append(struckNucleonCode).append(']');
        }
        if (struckQuarkIsSet()) {
            s.append("[q=").append(struckQuarkCode)
                    .append(seaQuark ? "(s)" : "(v)")
                    .append(']');
        }
        return s.toString();
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(" target PDG code = ").append(targetCode).append('\n');
        if (isNucleus() || isFreeNucleon()) {
            s.append(" Z = ").append(z).append(", A = ").append(a).append('\n');
        }
        if (struckNucleonIsSet()) {
            String name = tables.particles().find(struckNucleonCode)
                    .map(ParticleProperties::name)
                    .orElse(String.valueOf(struckNucleonCode));
            s.append(" struck nucleon = ").append(name)
                    .append(", P4 = ").append(struckNucleonP4.asString()).append('\n');
        }
        return s.toString();
    }
}

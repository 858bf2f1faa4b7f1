package com.smarts.parser;

import com.smarts.ast.BondType;
import com.smarts.ast.ChiralityClass;
import com.smarts.ast.SpecificationType;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol tables and operator characters of the SMARTS grammar.
 * <p>
 * The element lists are scanned in order and the first entry that matches wins, so
 * every symbol must appear before any shorter symbol that is a prefix of it
 * ({@code Cl} before {@code C}).
 */
public final class SmartsSymbols {

    private SmartsSymbols() {
    }

    /**
     * Element symbols allowed outside brackets.
     */
    public static final List<String> ORGANIC_SUBSET = List.of(
            "Br", "B", "Cl", "C", "N", "O", "S", "P", "F", "I",
            "b", "c", "n", "o", "s", "p"
    );

    /**
     * Element symbols allowed inside brackets. {@code H} is absent: inside brackets it
     * is always the attached-hydrogen count. {@code A} is absent as well, so {@code [A]}
     * is the aliphatic wildcard rather than an element named {@code A}.
     * <p>
     * Nihonium ({@code Nh}) is left out: it would turn {@code [Nh1]}, nitrogen with one
     * implicit hydrogen, into nihonium of mass 1.
     */
    public static final List<String> ELEMENTS = List.of(
            "Zr", "Zn", "Yb", "Y", "Xe", "W", "V", "U", "Ts", "Tm", "Tl",
            "Ti", "Th", "Te", "Tc", "Tb", "Ta", "Sr", "Sn", "Sm",
            "Si", "Sg", "Se", "Sc", "Sb", "S", "Ru", "Rn", "Rh",
            "Rg", "Rf", "Re", "Rb", "Ra", "Pu", "Pt", "Pr", "Po",
            "Pm", "Pd", "Pb", "Pa", "P", "Os", "Og", "O", "Np", "No", "Ni",
            "Ne", "Nd", "Nb", "Na", "N", "Mt", "Mo", "Mn", "Mg",
            "Md", "Mc", "Lv", "Lu", "Lr", "Li", "La", "Kr", "K", "Ir",
            "In", "I", "Hs", "Ho", "Hg", "Hf", "He", "Ge",
            "Gd", "Ga", "Fr", "Fm", "Fl", "Fe", "F", "Eu", "Es",
            "Er", "Dy", "Ds", "Db", "Cu", "Cs", "Cr", "Co", "Cn",
            "Cm", "Cl", "Cf", "Ce", "Cd", "Ca", "C", "Br", "Bk",
            "Bi", "Bh", "Be", "Ba", "B", "Au", "At", "As", "Ar",
            "Am", "Al", "Ag", "Ac",
            "se", "as", "b", "c", "n", "o", "s", "p"
    );

    /**
     * Chirality class codes, longest first so that {@code TB10} is tried before {@code TB1}.
     */
    public static final List<ChiralityClass> CHIRALITY_CLASSES = Arrays.stream(ChiralityClass.values())
            .sorted(Comparator.comparingInt((ChiralityClass c) -> c.code().length()).reversed())
            .toList();

    /**
     * Bond symbols in the order they are tried.
     */
    public static final Map<Character, BondType> BOND_TYPES_BY_SYMBOL;

    /**
     * Property codes of numeric atom properties whose count may be omitted, in the order they are tried.
     */
    public static final Map<SpecificationType, Character> PROPERTY_CODES;

    static {
        Map<Character, BondType> bonds = new LinkedHashMap<>();
        bonds.put(Operators.DOUBLE_BOND, BondType.DOUBLE);
        bonds.put(Operators.TRIPLE_BOND, BondType.TRIPLE);
        bonds.put(Operators.AROMATIC_BOND, BondType.AROMATIC);
        bonds.put(Operators.UP_BOND, BondType.UP);
        bonds.put(Operators.DOWN_BOND, BondType.DOWN);
        bonds.put(Operators.RING_BOND, BondType.RING);
        bonds.put(Operators.ANY_BOND, BondType.ANY);
        bonds.put(Operators.SINGLE_BOND, BondType.SINGLE);
        BOND_TYPES_BY_SYMBOL = Collections.unmodifiableMap(bonds);

        Map<SpecificationType, Character> codes = new LinkedHashMap<>();
        codes.put(SpecificationType.DEGREE, 'D');
        codes.put(SpecificationType.ATTACHED_HYDROGENS, 'H');
        codes.put(SpecificationType.IMPLICIT_HYDROGENS, 'h');
        codes.put(SpecificationType.RING_MEMBERSHIP, 'R');
        codes.put(SpecificationType.RING_SIZE, 'r');
        codes.put(SpecificationType.VALENCE, 'v');
        codes.put(SpecificationType.CONNECTIVITY, 'X');
        codes.put(SpecificationType.RING_CONNECTIVITY, 'x');
        codes.put(SpecificationType.NEGATIVE_CHARGE, Operators.MINUS);
        codes.put(SpecificationType.POSITIVE_CHARGE, Operators.PLUS);
        PROPERTY_CODES = Collections.unmodifiableMap(codes);
    }

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char NOT = '!';
        public static final char UNSPECIFIED = '?';

        public static final char LOW_AND = ';';
        public static final char OR = ',';
        public static final char AND = '&';

        public static final char SINGLE_BOND = '-';
        public static final char DOUBLE_BOND = '=';
        public static final char TRIPLE_BOND = '#';
        public static final char AROMATIC_BOND = ':';
        public static final char UP_BOND = '/';
        public static final char DOWN_BOND = '\\';
        public static final char RING_BOND = '@';
        public static final char ANY_BOND = '~';

        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char PERCENT = '%';

        public static final char ANY_ATOM = '*';
        public static final char ANY_ALIPHATIC = 'A';
        public static final char ANY_AROMATIC = 'a';

        public static final char ATOMIC_NUMBER = '#';
        public static final char CHIRAL = '@';
        public static final char MINUS = '-';
        public static final char PLUS = '+';
        public static final char CLASS = ':';
        public static final String RECURSIVE_OPEN = "$(";

        private Operators() {
        }
    }
}

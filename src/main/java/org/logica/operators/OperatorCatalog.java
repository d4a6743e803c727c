package org.logica.operators;

import org.logica.propositions.Atom;
import org.logica.propositions.Literal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * CATALOGO DEGLI OPERATORI - Contesto esplicito e immutabile delle proprietà algebriche
 *
 * Associa a ogni operatore registrato arità, duale, converso, elementi neutri,
 * commutatività, associatività, direzione di piegatura e regola di riscrittura.
 * Tutte le operazioni del motore consultano il catalogo tramite un'unica funzione
 * di dispatch ({@link #properties(LogicalOperator)}).
 *
 * ESTENSIONE:
 * • {@link Builder#register(String, String, Proposition)} aggiunge un operatore definito
 *   da una regola sui segnaposto $1..$n
 * • le proprietà vengono VERIFICATE per valutazione esaustiva, non dichiarate
 * • l'esito è un {@link Registration} con l'elenco delle proprietà non scoperte
 *
 * Il catalogo predefinito è {@link #standard()}; ogni estensione produce una nuova istanza.
 */
public final class OperatorCatalog {

    private static final Logger LOGGER = Logger.getLogger(OperatorCatalog.class.getName());

    /** Numero massimo di segnaposto in una regola personalizzata (tabella di verità in un long). */
    static final int MAX_RULE_ARITY = 6;

    private final Map<String, LogicalOperator> operatorsByName;
    private final Map<LogicalOperator, OperatorProperties> properties;

    private OperatorCatalog(Map<String, LogicalOperator> operatorsByName,
                            Map<LogicalOperator, OperatorProperties> properties) {
        this.operatorsByName = Collections.unmodifiableMap(new LinkedHashMap<>(operatorsByName));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    private static final class StandardHolder {
        static final OperatorCatalog STANDARD = createStandard();
    }

    /** Catalogo condiviso con i soli connettivi predefiniti. */
    public static OperatorCatalog standard() {
        return StandardHolder.STANDARD;
    }

    public static Builder builder() {
        return standard().toBuilder();
    }

    /** Nuovo builder che parte dagli operatori di questo catalogo. */
    public Builder toBuilder() {
        return new Builder(operatorsByName, properties);
    }

    //region INTERROGAZIONE

    public Optional<LogicalOperator> lookup(String name) {
        return Optional.ofNullable(operatorsByName.get(name));
    }

    public boolean isRegistered(LogicalOperator operator) {
        return properties.containsKey(operator);
    }

    /** Operatori registrati nell'ordine di registrazione. */
    public List<LogicalOperator> operators() {
        return List.copyOf(properties.keySet());
    }

    /**
     * Funzione di dispatch unica verso i metadati dell'operatore.
     *
     * @throws IllegalArgumentException se l'operatore non è registrato
     */
    public OperatorProperties properties(LogicalOperator operator) {
        OperatorProperties found = properties.get(operator);
        if (found == null) {
            throw new IllegalArgumentException("Operatore non registrato nel catalogo: "
                    + (operator == null ? "null" : operator.getName()));
        }
        return found;
    }

    public Arity arity(LogicalOperator operator) {
        return properties(operator).operator().getArity();
    }

    /**
     * @throws UndefinedOperatorBehaviorException se nessun duale è stato scoperto
     */
    public LogicalOperator dual(LogicalOperator operator) {
        LogicalOperator dual = properties(operator).dual();
        if (dual == null) {
            throw new UndefinedOperatorBehaviorException("Nessun duale noto per l'operatore '" + operator.getName() + "'");
        }
        return dual;
    }

    public Optional<LogicalOperator> findDual(LogicalOperator operator) {
        return Optional.ofNullable(properties(operator).dual());
    }

    /**
     * @throws UndefinedOperatorBehaviorException se nessun converso è stato scoperto
     */
    public LogicalOperator converse(LogicalOperator operator) {
        LogicalOperator converse = properties(operator).converse();
        if (converse == null) {
            throw new UndefinedOperatorBehaviorException("Nessun converso noto per l'operatore '" + operator.getName() + "'");
        }
        return converse;
    }

    public PropertyStatus commutativity(LogicalOperator operator) {
        return properties(operator).commutative();
    }

    public boolean isCommutative(LogicalOperator operator) {
        return commutativity(operator) == PropertyStatus.HOLDS;
    }

    public PropertyStatus associativity(LogicalOperator operator) {
        return properties(operator).associative();
    }

    public boolean isAssociative(LogicalOperator operator) {
        return associativity(operator) == PropertyStatus.HOLDS;
    }

    public Optional<Operator> leftIdentity(LogicalOperator operator) {
        return Optional.ofNullable(properties(operator).leftIdentity());
    }

    public Optional<Operator> rightIdentity(LogicalOperator operator) {
        return Optional.ofNullable(properties(operator).rightIdentity());
    }

    public FoldDirection foldDirection(LogicalOperator operator) {
        return properties(operator).foldDirection();
    }

    public Optional<Proposition> rule(LogicalOperator operator) {
        return Optional.ofNullable(properties(operator).rule());
    }

    //endregion

    //region VALUTAZIONE BOOLEANA

    /**
     * Calcola il valore di verità di un'applicazione dell'operatore.
     * I connettivi predefiniti sono calcolati direttamente, quelli personalizzati
     * valutando la loro regola.
     *
     * @throws ArityMismatchException se il numero di argomenti non rispetta l'arità
     */
    public boolean evaluate(LogicalOperator operator, boolean... args) {
        return evaluate(properties, operator, args);
    }

    private static boolean evaluate(Map<LogicalOperator, OperatorProperties> table,
                                    LogicalOperator operator, boolean... args) {
        OperatorProperties props = table.get(operator);
        if (props == null) {
            throw new IllegalArgumentException("Operatore non registrato nel catalogo: " + operator.getName());
        }
        if (!operator.getArity().accepts(args.length)) {
            throw new ArityMismatchException(operator, args.length);
        }
        if (operator instanceof Operator) {
            return evaluateBuiltIn((Operator) operator, args);
        }
        return evaluateRule(table, props.rule(), args);
    }

    private static boolean evaluateBuiltIn(Operator operator, boolean[] a) {
        return switch (operator) {
            case TAUTOLOGY -> true;
            case CONTRADICTION -> false;
            case IDENTITY -> a[0];
            case NOT -> !a[0];
            case AND -> a[0] && a[1];
            case NAND -> !(a[0] && a[1]);
            case NOR -> !(a[0] || a[1]);
            case OR -> a[0] || a[1];
            case XOR -> a[0] != a[1];
            case XNOR -> a[0] == a[1];
            case IMPLY -> !a[0] || a[1];
            case NOT_IMPLY -> a[0] && !a[1];
            case CONVERSE_IMPLY -> a[0] || !a[1];
            case NOT_CONVERSE_IMPLY -> !a[0] && a[1];
            case CONJUNCTION -> allTrue(a);
            case DISJUNCTION -> anyTrue(a);
        };
    }

    /** Valuta una regola sostituendo il segnaposto $i con args[i-1]. */
    private static boolean evaluateRule(Map<LogicalOperator, OperatorProperties> table,
                                        Proposition rule, boolean[] args) {
        switch (rule.getKind()) {
            case VARIABLE -> {
                Variable variable = (Variable) rule;
                if (!variable.isPlaceholder()) {
                    throw new IllegalArgumentException("Variabile non ammessa in una regola: " + variable);
                }
                return args[variable.placeholderIndex() - 1];
            }
            case LITERAL -> {
                Literal literal = (Literal) rule;
                boolean value = evaluateRule(table, literal.getAtom(), args);
                return literal.isPositive() == value;
            }
            case TREE, CLAUSE, NORMAL -> {
                List<Proposition> children = rule.children();
                boolean[] values = new boolean[children.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = evaluateRule(table, children.get(i), args);
                }
                if (rule.getKind() == Proposition.Kind.TREE) {
                    return evaluate(table, rule.getOperator(), values);
                }
                return rule.getOperator() == Operator.AND ? allTrue(values) : anyTrue(values);
            }
            default -> throw new IllegalArgumentException("Costante non ammessa in una regola: " + rule);
        }
    }

    private static boolean allTrue(boolean[] values) {
        for (boolean value : values) {
            if (!value) return false;
        }
        return true;
    }

    private static boolean anyTrue(boolean[] values) {
        for (boolean value : values) {
            if (value) return true;
        }
        return false;
    }

    //endregion

    //region CATALOGO PREDEFINITO

    private static OperatorCatalog createStandard() {
        Map<String, LogicalOperator> byName = new LinkedHashMap<>();
        Map<LogicalOperator, OperatorProperties> table = new LinkedHashMap<>();

        Variable p = Variable.placeholder(1);
        Variable q = Variable.placeholder(2);
        Literal notP = Literal.of(Operator.NOT, p);
        Literal notQ = Literal.of(Operator.NOT, q);

        put(byName, table, builtIn(Operator.TAUTOLOGY, Operator.CONTRADICTION, null, null, null, null));
        put(byName, table, builtIn(Operator.CONTRADICTION, Operator.TAUTOLOGY, null, null, null, null));
        put(byName, table, builtIn(Operator.IDENTITY, Operator.IDENTITY, null, null, FoldDirection.LEFT, p));
        put(byName, table, builtIn(Operator.NOT, Operator.NOT, null, null, FoldDirection.LEFT, null));
        put(byName, table, builtIn(Operator.AND, Operator.OR, Operator.TAUTOLOGY, Operator.TAUTOLOGY, FoldDirection.LEFT, null));
        put(byName, table, builtIn(Operator.NAND, Operator.NOR, null, null, FoldDirection.LEFT,
                Tree.of(Operator.NOT, Tree.of(Operator.AND, p, q))));
        put(byName, table, builtIn(Operator.NOR, Operator.NAND, null, null, FoldDirection.LEFT,
                Tree.of(Operator.NOT, Tree.of(Operator.OR, p, q))));
        put(byName, table, builtIn(Operator.OR, Operator.AND, Operator.CONTRADICTION, Operator.CONTRADICTION, FoldDirection.LEFT, null));
        put(byName, table, builtIn(Operator.XOR, Operator.XNOR, Operator.CONTRADICTION, Operator.CONTRADICTION, FoldDirection.LEFT,
                Tree.of(Operator.AND, Tree.of(Operator.OR, p, q), Tree.of(Operator.OR, notP, notQ))));
        put(byName, table, builtIn(Operator.XNOR, Operator.XOR, Operator.TAUTOLOGY, Operator.TAUTOLOGY, FoldDirection.LEFT,
                Tree.of(Operator.OR, Tree.of(Operator.AND, p, q), Tree.of(Operator.AND, notP, notQ))));
        put(byName, table, builtIn(Operator.IMPLY, Operator.NOT_CONVERSE_IMPLY, Operator.TAUTOLOGY, null, FoldDirection.LEFT,
                Tree.of(Operator.OR, notP, q)));
        put(byName, table, builtIn(Operator.NOT_IMPLY, Operator.CONVERSE_IMPLY, null, Operator.CONTRADICTION, FoldDirection.RIGHT,
                Tree.of(Operator.AND, p, notQ)));
        put(byName, table, builtIn(Operator.CONVERSE_IMPLY, Operator.NOT_IMPLY, null, Operator.TAUTOLOGY, FoldDirection.RIGHT,
                Tree.of(Operator.OR, p, notQ)));
        put(byName, table, builtIn(Operator.NOT_CONVERSE_IMPLY, Operator.IMPLY, Operator.CONTRADICTION, null, FoldDirection.LEFT,
                Tree.of(Operator.AND, notP, q)));
        put(byName, table, builtIn(Operator.CONJUNCTION, Operator.DISJUNCTION, Operator.TAUTOLOGY, Operator.TAUTOLOGY, FoldDirection.LEFT, null));
        put(byName, table, builtIn(Operator.DISJUNCTION, Operator.CONJUNCTION, Operator.CONTRADICTION, Operator.CONTRADICTION, FoldDirection.LEFT, null));

        LOGGER.fine("Catalogo predefinito inizializzato con " + table.size() + " operatori");
        return new OperatorCatalog(byName, table);
    }

    private static OperatorProperties builtIn(Operator operator, Operator dual, Operator leftIdentity,
                                              Operator rightIdentity, FoldDirection direction, Proposition rule) {
        PropertyStatus commutative;
        PropertyStatus associative;
        Operator converse;
        switch (operator) {
            case AND, OR, XOR, XNOR, CONJUNCTION, DISJUNCTION -> {
                commutative = PropertyStatus.HOLDS;
                associative = PropertyStatus.HOLDS;
                converse = operator;
            }
            case NAND, NOR -> {
                commutative = PropertyStatus.HOLDS;
                associative = PropertyStatus.FAILS;
                converse = operator;
            }
            case IMPLY, NOT_IMPLY, CONVERSE_IMPLY, NOT_CONVERSE_IMPLY -> {
                commutative = PropertyStatus.FAILS;
                associative = PropertyStatus.FAILS;
                converse = switch (operator) {
                    case IMPLY -> Operator.CONVERSE_IMPLY;
                    case CONVERSE_IMPLY -> Operator.IMPLY;
                    case NOT_IMPLY -> Operator.NOT_CONVERSE_IMPLY;
                    default -> Operator.NOT_IMPLY;
                };
            }
            default -> {
                commutative = PropertyStatus.UNDETERMINED;
                associative = PropertyStatus.UNDETERMINED;
                converse = operator;
            }
        }
        return new OperatorProperties(operator, commutative, associative, leftIdentity, rightIdentity,
                dual, converse, direction == null ? FoldDirection.LEFT : direction, rule);
    }

    private static void put(Map<String, LogicalOperator> byName, Map<LogicalOperator, OperatorProperties> table,
                            OperatorProperties props) {
        byName.put(props.operator().getName(), props.operator());
        table.put(props.operator(), props);
    }

    //endregion

    //region REGISTRAZIONE OPERATORI PERSONALIZZATI

    /**
     * Costruttore di cataloghi estesi. Ogni chiamata a {@link #register} verifica
     * le proprietà del nuovo operatore rispetto agli operatori già presenti nel builder.
     */
    public static final class Builder {

        private final Map<String, LogicalOperator> byName;
        private final Map<LogicalOperator, OperatorProperties> table;

        private Builder(Map<String, LogicalOperator> byName, Map<LogicalOperator, OperatorProperties> table) {
            this.byName = new LinkedHashMap<>(byName);
            this.table = new LinkedHashMap<>(table);
        }

        /**
         * Registra un operatore definito da una regola sui segnaposto $1..$n.
         *
         * @param name nome univoco
         * @param symbol simbolo di stampa
         * @param rule proposizione costruita con operatori già registrati
         * @return diagnostica della registrazione
         * @throws IllegalArgumentException se nome, simbolo o regola non sono validi
         */
        public Registration register(String name, String symbol, Proposition rule) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Il nome dell'operatore non può essere null o vuoto");
            }
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Il simbolo dell'operatore non può essere null o vuoto");
            }
            if (rule == null) {
                throw new IllegalArgumentException("La regola dell'operatore non può essere null");
            }
            if (byName.containsKey(name)) {
                throw new IllegalArgumentException("Operatore già registrato: " + name);
            }

            int arity = validateRule(rule);
            CustomOperator operator = new CustomOperator(name, symbol, Arity.of(arity));
            List<String> warnings = new ArrayList<>();

            // La regola viene valutata prima che l'operatore sia nel catalogo
            long truthTable = truthTable(arity, args -> evaluateRule(table, rule, args));

            PropertyStatus commutative = PropertyStatus.UNDETERMINED;
            PropertyStatus associative = PropertyStatus.UNDETERMINED;
            Operator leftIdentity = null;
            Operator rightIdentity = null;
            if (arity == 2) {
                commutative = holds(truthTable, row -> swap(row), 2);
                associative = checkAssociativity(truthTable);
                leftIdentity = findIdentity(truthTable, true);
                rightIdentity = findIdentity(truthTable, false);
            } else {
                warnings.add("Commutatività e associatività indecidibili per arità " + arity);
            }

            FoldDirection direction = leftIdentity != null || rightIdentity == null
                    ? FoldDirection.LEFT : FoldDirection.RIGHT;

            LogicalOperator dual = findMatch(operator, arity, dualTable(truthTable, arity), truthTable);
            if (dual == null) {
                warnings.add("Nessun duale tra gli operatori registrati per '" + name + "'");
            }

            LogicalOperator converse;
            if (arity == 2) {
                converse = commutative == PropertyStatus.HOLDS ? operator
                        : findMatch(operator, arity, converseTable(truthTable), truthTable);
                if (converse == null) {
                    warnings.add("Nessun converso tra gli operatori registrati per '" + name + "'");
                }
            } else {
                converse = operator;
            }

            OperatorProperties props = new OperatorProperties(operator, commutative, associative,
                    leftIdentity, rightIdentity, dual, converse, direction, rule);
            byName.put(name, operator);
            table.put(operator, props);
            backfill(operator, arity, truthTable);

            LOGGER.fine("Registrato operatore '" + name + "' (arità " + arity + ", duale "
                    + (dual == null ? "assente" : dual.getName()) + ")");
            if (!warnings.isEmpty()) {
                LOGGER.warning("Registrazione incompleta di '" + name + "': " + warnings);
            }
            return new Registration(operator, props, warnings);
        }

        public OperatorCatalog build() {
            return new OperatorCatalog(byName, table);
        }

        /** Controlla segnaposto contigui e operatori registrati, restituisce l'arità. */
        private int validateRule(Proposition rule) {
            TreeSet<Integer> indices = new TreeSet<>();
            for (Atom atom : rule.atoms()) {
                if (!(atom instanceof Variable) || !((Variable) atom).isPlaceholder()) {
                    throw new IllegalArgumentException("Una regola può contenere solo segnaposto $1..$n, trovato: " + atom);
                }
                indices.add(((Variable) atom).placeholderIndex());
            }
            if (!indices.isEmpty() && (indices.first() != 1 || indices.last() != indices.size())) {
                throw new IllegalArgumentException("I segnaposto della regola devono essere contigui da $1: " + indices);
            }
            if (indices.size() > MAX_RULE_ARITY) {
                throw new IllegalArgumentException("Troppi segnaposto nella regola: " + indices.size());
            }
            for (LogicalOperator used : rule.operators()) {
                if (!table.containsKey(used)) {
                    throw new IllegalArgumentException("La regola usa un operatore non registrato: " + used.getName());
                }
            }
            return indices.size();
        }

        private LogicalOperator findMatch(LogicalOperator candidate, int arity, long wanted, long ownTable) {
            if (wanted == ownTable) {
                return candidate;
            }
            for (OperatorProperties props : table.values()) {
                LogicalOperator other = props.operator();
                if (other.getArity().isUnbounded() || other.getArity().value() != arity) {
                    continue;
                }
                long otherTable = truthTable(arity, args -> evaluate(table, other, args));
                if (otherTable == wanted) {
                    return other;
                }
            }
            return null;
        }

        /** Completa duale e converso degli operatori personalizzati registrati in precedenza. */
        private void backfill(CustomOperator added, int arity, long addedTable) {
            long dualOfAdded = dualTable(addedTable, arity);
            long converseOfAdded = arity == 2 ? converseTable(addedTable) : addedTable;
            for (Map.Entry<LogicalOperator, OperatorProperties> entry : table.entrySet()) {
                OperatorProperties props = entry.getValue();
                LogicalOperator other = props.operator();
                if (other.equals(added) || !(other instanceof CustomOperator)
                        || other.getArity().value() != arity) {
                    continue;
                }
                long otherTable = truthTable(arity, args -> evaluate(table, other, args));
                if (props.dual() == null && otherTable == dualOfAdded) {
                    props = props.withDual(added);
                    LOGGER.fine("Duale di '" + other.getName() + "' scoperto: " + added.getName());
                }
                if (props.converse() == null && otherTable == converseOfAdded) {
                    props = props.withConverse(added);
                    LOGGER.fine("Converso di '" + other.getName() + "' scoperto: " + added.getName());
                }
                entry.setValue(props);
            }
        }
    }

    //endregion

    //region TABELLE DI VERITÀ COMPATTE

    /** Funzione booleana su un vettore di argomenti. */
    @FunctionalInterface
    private interface BooleanFunction {
        boolean apply(boolean[] args);
    }

    @FunctionalInterface
    private interface RowMapping {
        int map(int row);
    }

    /** Riga r: l'argomento i vale il bit i di r. Il bit r del risultato è f(riga r). */
    private static long truthTable(int arity, BooleanFunction function) {
        long result = 0L;
        for (int row = 0; row < (1 << arity); row++) {
            if (function.apply(row(row, arity))) {
                result |= 1L << row;
            }
        }
        return result;
    }

    private static boolean[] row(int row, int arity) {
        boolean[] args = new boolean[arity];
        for (int i = 0; i < arity; i++) {
            args[i] = ((row >> i) & 1) == 1;
        }
        return args;
    }

    private static boolean bit(long table, int row) {
        return ((table >> row) & 1L) == 1L;
    }

    private static int swap(int row) {
        return ((row & 1) << 1) | ((row >> 1) & 1);
    }

    private static PropertyStatus holds(long table, RowMapping mapping, int arity) {
        for (int row = 0; row < (1 << arity); row++) {
            if (bit(table, row) != bit(table, mapping.map(row))) {
                return PropertyStatus.FAILS;
            }
        }
        return PropertyStatus.HOLDS;
    }

    private static boolean binary(long table, boolean a, boolean b) {
        return bit(table, (a ? 1 : 0) | (b ? 2 : 0));
    }

    private static PropertyStatus checkAssociativity(long table) {
        for (int row = 0; row < 8; row++) {
            boolean[] v = row(row, 3);
            boolean left = binary(table, binary(table, v[0], v[1]), v[2]);
            boolean right = binary(table, v[0], binary(table, v[1], v[2]));
            if (left != right) {
                return PropertyStatus.FAILS;
            }
        }
        return PropertyStatus.HOLDS;
    }

    private static Operator findIdentity(long table, boolean leftSide) {
        for (Operator candidate : List.of(Operator.TAUTOLOGY, Operator.CONTRADICTION)) {
            boolean e = candidate == Operator.TAUTOLOGY;
            boolean neutral = true;
            for (boolean x : new boolean[]{false, true}) {
                boolean value = leftSide ? binary(table, e, x) : binary(table, x, e);
                neutral &= value == x;
            }
            if (neutral) {
                return candidate;
            }
        }
        return null;
    }

    /** Tabella di ¬f(¬a1, ..., ¬an). */
    private static long dualTable(long table, int arity) {
        int rows = 1 << arity;
        long result = 0L;
        for (int row = 0; row < rows; row++) {
            int complement = ~row & (rows - 1);
            if (!bit(table, complement)) {
                result |= 1L << row;
            }
        }
        return result;
    }

    /** Tabella di f($2, $1). */
    private static long converseTable(long table) {
        long result = 0L;
        for (int row = 0; row < 4; row++) {
            if (bit(table, swap(row))) {
                result |= 1L << row;
            }
        }
        return result;
    }

    //endregion
}

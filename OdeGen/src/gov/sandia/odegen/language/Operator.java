/*
Copyright 2013-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

import java.util.HashMap;
import java.util.Map;

import gov.sandia.odegen.eqset.VariableEntry;
import gov.sandia.odegen.model.Variable;

/**
    Node of an equation tree.
    Every node has at most two children. MathML operators that take more than two operands
    are stored as a right-leaning chain of nodes of the same kind, so a+b+c becomes a+(b+c).
    Unary operators only populate left.
**/
public class Operator
{
    public Kind          kind;
    public String        value;        // literal text of a cn
    public Variable      declaration;  // for a ci, the variable as declared in the component that holds the equation
    public VariableEntry variable;     // for a ci, the canonical record shared by all equivalent declarations
    public Operator      left;
    public Operator      right;

    public enum Kind
    {
        // Relational
        EQ        ("eq",         "eq"),
        EQEQ      (null,         "eqEq"),
        NEQ       ("neq",        "neq"),
        LT        ("lt",         "lt"),
        LEQ       ("leq",        "leq"),
        GT        ("gt",         "gt"),
        GEQ       ("geq",        "geq"),

        // Arithmetic
        PLUS      ("plus",       "plus"),
        MINUS     ("minus",      "minus"),
        TIMES     ("times",      "times"),
        DIVIDE    ("divide",     "divide"),
        POWER     ("power",      "power"),
        ROOT      ("root",       "squareRoot"),
        ABS       ("abs",        "absoluteValue"),
        EXP       ("exp",        "exponential"),
        LN        ("ln",         "napierianLogarithm"),
        LOG       ("log",        "commonLogarithm"),
        CEILING   ("ceiling",    "ceiling"),
        FLOOR     ("floor",      "floor"),
        FACTORIAL ("factorial",  "factorial", MathFunction.FACTORIAL),
        MIN       ("min",        "min",       MathFunction.MIN),
        MAX       ("max",        "max",       MathFunction.MAX),
        GCD       ("gcd",        "gcd",       MathFunction.GCD),
        LCM       ("lcm",        "lcm",       MathFunction.LCM),
        REM       ("rem",        "rem"),

        // Logical
        AND       ("and",        "and"),
        OR        ("or",         "or"),
        XOR       ("xor",        "xor"),
        NOT       ("not",        "not"),

        // Calculus
        DIFF      ("diff",       null),

        // Trigonometric
        SIN       ("sin",        "sin"),
        COS       ("cos",        "cos"),
        TAN       ("tan",        "tan"),
        SEC       ("sec",        "sec",   MathFunction.SEC),
        CSC       ("csc",        "csc",   MathFunction.CSC),
        COT       ("cot",        "cot",   MathFunction.COT),
        SINH      ("sinh",       "sinh"),
        COSH      ("cosh",       "cosh"),
        TANH      ("tanh",       "tanh"),
        SECH      ("sech",       "sech",  MathFunction.SECH),
        CSCH      ("csch",       "csch",  MathFunction.CSCH),
        COTH      ("coth",       "coth",  MathFunction.COTH),
        ASIN      ("arcsin",     "asin"),
        ACOS      ("arccos",     "acos"),
        ATAN      ("arctan",     "atan"),
        ASEC      ("arcsec",     "asec",  MathFunction.ASEC),
        ACSC      ("arccsc",     "acsc",  MathFunction.ACSC),
        ACOT      ("arccot",     "acot",  MathFunction.ACOT),
        ASINH     ("arcsinh",    "asinh"),
        ACOSH     ("arccosh",    "acosh"),
        ATANH     ("arctanh",    "atanh"),
        ASECH     ("arcsech",    "asech", MathFunction.ASECH),
        ACSCH     ("arccsch",    "acsch", MathFunction.ACSCH),
        ACOTH     ("arccoth",    "acoth", MathFunction.ACOTH),

        // Piecewise
        PIECEWISE ("piecewise",  null),
        PIECE     ("piece",      null),
        OTHERWISE ("otherwise",  null),

        // Token
        CI        ("ci",         null),
        CN        ("cn",         null),

        // Qualifier
        DEGREE    ("degree",     null),
        LOGBASE   ("logbase",    null),
        BVAR      ("bvar",       null),

        // Constant
        TRUE      ("true",         "true"),
        FALSE     ("false",        "false"),
        E         ("exponentiale", "e"),
        PI        ("pi",           "pi"),
        INF       ("infinity",     "infinity"),
        NAN       ("notanumber",   "nan");

        public final String       element;  // MathML element name, or null if the kind never comes directly from markup
        public final String       key;      // profile key for the rendered text
        public final MathFunction helper;   // function the target may need to define, or null

        protected static Map<String,Kind> elements = new HashMap<String,Kind> ();
        static
        {
            for (Kind k : values ()) if (k.element != null) elements.put (k.element, k);
        }

        Kind (String element, String key)
        {
            this (element, key, null);
        }

        Kind (String element, String key, MathFunction helper)
        {
            this.element = element;
            this.key     = key;
            this.helper  = helper;
        }

        public static Kind forElement (String name)
        {
            return elements.get (name);
        }

        public boolean isRelational ()
        {
            switch (this)
            {
                case EQEQ:
                case NEQ:
                case LT:
                case LEQ:
                case GT:
                case GEQ:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isLogical ()
        {
            return this == AND  ||  this == OR  ||  this == XOR;
        }

        public boolean isConstant ()
        {
            return ordinal () >= TRUE.ordinal ();
        }
    }

    public Operator (Kind kind)
    {
        this.kind = kind;
    }

    public Operator (Kind kind, Operator left, Operator right)
    {
        this.kind  = kind;
        this.left  = left;
        this.right = right;
    }

    /**
        A plus or minus that has two operands, as opposed to the unary form.
    **/
    public boolean isBinary (Kind k)
    {
        return kind == k  &&  right != null;
    }

    /**
        The numeric value of a literal, looking through the degree or logbase qualifier that wraps it.
        NaN if this is not a literal number.
    **/
    public double literal ()
    {
        if (kind == Kind.DEGREE  ||  kind == Kind.LOGBASE)
        {
            if (left == null) return Double.NaN;
            return left.literal ();
        }
        if (kind != Kind.CN  ||  value == null) return Double.NaN;
        try
        {
            return Double.parseDouble (value);
        }
        catch (NumberFormatException e)
        {
            return Double.NaN;
        }
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append (kind);
        if (value    != null) result.append (" " + value);
        if (variable != null) result.append (" " + variable);
        if (left != null  ||  right != null)
        {
            result.append (" (");
            result.append (left);
            if (right != null) result.append (", " + right);
            result.append (")");
        }
        return result.toString ();
    }
}

/*
Copyright 2013-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

import java.util.EnumSet;

import gov.sandia.odegen.backend.Profile;
import gov.sandia.odegen.eqset.VariableEntry;
import gov.sandia.odegen.eqset.VariableEntry.Role;
import gov.sandia.odegen.language.Operator.Kind;

/**
    Converts equation trees into target-language text according to a profile.
    Text accumulates in result. Every function that the target may lack is recorded in needed,
    so the caller can emit definitions for them afterward.
**/
public class Renderer
{
    public Profile                profile;
    public StringBuilder          result;
    public EnumSet<MathFunction>  needed = EnumSet.noneOf (MathFunction.class);

    public Renderer (Profile profile)
    {
        this (profile, new StringBuilder ());
    }

    public Renderer (Profile profile, StringBuilder result)
    {
        this.profile = profile;
        this.result  = result;
    }

    public void render (Operator op)
    {
        result.append (code (op, null));
    }

    /**
        @param parent The node that holds op in the tree, or null at the root.
        A variable directly under diff renders as a rate, and nested min/max/gcd/lcm fold into their parent's argument list.
    **/
    public String code (Operator op, Operator parent)
    {
        if (op == null) return "";
        if (op.kind.helper != null) needed.add (op.kind.helper);

        switch (op.kind)
        {
            case EQ:
            case EQEQ:
            case NEQ:
            case LT:
            case LEQ:
            case GT:
            case GEQ:
            case TIMES:
            case DIVIDE:
            case AND:
            case OR:
                return binary (op, profile.operator (op.kind.key));

            case PLUS:
                if (op.right == null) return code (op.left, op);
                return binary (op, profile.operator ("plus"));
            case MINUS:
                if (op.right == null)
                {
                    String left = code (op.left, op);
                    if (needsParensUnary (op.left)) left = "(" + left + ")";
                    return profile.operator ("minus") + left;
                }
                return binary (op, profile.operator ("minus"));

            case POWER:
            {
                double exponent = op.right == null ? Double.NaN : op.right.literal ();
                if (exponent == 0.5) return call ("squareRoot", op.left, op);
                if (exponent == 2.0)
                {
                    needed.add (MathFunction.SQUARE);
                    return call ("square", op.left, op);
                }
                if (profile.has ("powerOperator")) return binary (op, profile.operator ("power"));
                return profile.operator ("power") + "(" + code (op.left, op) + ", " + code (op.right, op) + ")";
            }
            case ROOT:
            {
                if (op.right == null) return call ("squareRoot", op.left, op);
                // left holds the degree, right the radicand
                if (op.left != null  &&  op.left.literal () == 2.0) return call ("squareRoot", op.right, op);
                String degree   = code (op.left,  op);
                String radicand = code (op.right, op);
                String power    = profile.operator ("power");
                if (profile.has ("powerOperator"))
                {
                    if (needsParens (op, op.right, false)) radicand = "(" + radicand + ")";
                    if (needsParens (op, op.left,  true))  degree   = "(" + degree   + ")";
                    return radicand + power + "(1.0/" + degree + ")";
                }
                return power + "(" + radicand + ", 1.0/" + degree + ")";
            }
            case LOG:
            {
                if (op.right == null) return call ("commonLogarithm", op.left, op);
                // left holds the base
                if (op.left != null  &&  op.left.literal () == 10.0) return call ("commonLogarithm", op.right, op);
                return call ("napierianLogarithm", op.right, op) + profile.operator ("divide") + call ("napierianLogarithm", op.left, op);
            }

            case XOR:
                if (profile.has ("xorOperator")) return binary (op, profile.operator ("xor"));
                needed.add (MathFunction.XOR);
                return profile.operator ("xor") + "(" + code (op.left, op) + ", " + code (op.right, op) + ")";
            case NOT:
            {
                String operand = code (op.left, op);
                if (needsParensUnary (op.left)) operand = "(" + operand + ")";
                return profile.operator ("not") + operand;
            }

            case MIN:
            case MAX:
            case GCD:
            case LCM:
            {
                String arguments = code (op.left, op);
                if (op.right != null) arguments += ", " + code (op.right, op);
                if (parent != null  &&  parent.kind == op.kind) return arguments;
                return profile.operator (op.kind.key) + "(" + arguments + ")";
            }
            case REM:
                return profile.operator ("rem") + "(" + code (op.left, op) + ", " + code (op.right, op) + ")";

            case DIFF:
                return code (op.right, op);

            case PIECEWISE:
            {
                String left = code (op.left, op);
                if (op.right == null) return left + otherwise (profile.constant ("nan"));
                String right = code (op.right, op);
                if (op.right.kind == Kind.PIECE) return left + otherwise (right + otherwise (profile.constant ("nan")));
                return left + otherwise (right);
            }
            case PIECE:
            {
                String template = profile.conditional ("if");
                template = replace (template, "#cond", code (op.right, op));
                return replace (template, "#if", code (op.left, op));
            }
            case OTHERWISE:
            case DEGREE:
            case LOGBASE:
            case BVAR:
                return code (op.left, op);

            case CN:
                return op.value;
            case CI:
                return variable (op.variable, parent);

            case TRUE:
            case FALSE:
            case E:
            case PI:
            case INF:
            case NAN:
                return profile.constant (op.kind.key);

            default:  // single-argument functions
                return call (op.kind.key, op.left, op);
        }
    }

    public String variable (VariableEntry v, Operator parent)
    {
        if (v.role == Role.INTEGRATION_VARIABLE) return profile.array ("voi");
        String array;
        if (v.role == Role.STATE) array = parent != null  &&  parent.kind == Kind.DIFF ? "rates" : "states";
        else                      array = "variables";
        return profile.array (array) + "[" + v.index + "]";
    }

    protected String call (String key, Operator argument, Operator parent)
    {
        return profile.operator (key) + "(" + code (argument, parent) + ")";
    }

    protected String otherwise (String value)
    {
        return replace (profile.conditional ("else"), "#else", value);
    }

    protected String binary (Operator op, String symbol)
    {
        String left  = code (op.left,  op);
        String right = code (op.right, op);
        if (needsParens (op, op.left,  true))  left  = "(" + left  + ")";
        if (needsParens (op, op.right, false)) right = "(" + right + ")";
        return left + symbol + right;
    }

    /**
        Replaces the first occurrence of a template token.
    **/
    public static String replace (String template, String token, String value)
    {
        int position = template.indexOf (token);
        if (position < 0) return template;
        return template.substring (0, position) + value + template.substring (position + token.length ());
    }

    protected boolean needsParensUnary (Operator child)
    {
        if (child == null) return false;
        Kind k = child.kind;
        return  k.isRelational ()  ||  k == Kind.PLUS  ||  k == Kind.MINUS  ||  k.isLogical ()  ||  k == Kind.PIECEWISE;
    }

    /**
        Decides whether an operand must be enclosed in parentheses under the given binary operator.
        Unary plus and minus bind tightly, so they only count when the child actually has two operands.
        For root, the left operand is the degree and the right operand is the radicand.
    **/
    public boolean needsParens (Operator parent, Operator child, boolean isLeft)
    {
        if (child == null) return false;
        Kind    k          = child.kind;
        boolean relational = k.isRelational ();
        boolean logical    = k.isLogical ();
        boolean piecewise  = k == Kind.PIECEWISE;
        boolean plus       = child.isBinary (Kind.PLUS);
        boolean minus      = child.isBinary (Kind.MINUS);
        boolean power      = (k == Kind.POWER  ||  k == Kind.ROOT)  &&  profile.has ("powerOperator");
        switch (parent.kind)
        {
            case PLUS:
                return relational  ||  logical  ||  piecewise;
            case MINUS:
                if (isLeft) return relational  ||  logical  ||  piecewise;
                return relational  ||  k == Kind.MINUS  ||  plus  ||  logical  ||  piecewise;
            case TIMES:
                return relational  ||  plus  ||  minus  ||  logical  ||  piecewise;
            case DIVIDE:
                if (isLeft) return relational  ||  plus  ||  minus  ||  logical  ||  piecewise;
                return relational  ||  plus  ||  minus  ||  k == Kind.TIMES  ||  k == Kind.DIVIDE  ||  logical  ||  piecewise;
            case AND:
                return relational  ||  plus  ||  minus  ||  k == Kind.OR   ||  k == Kind.XOR  ||  power  ||  piecewise;
            case OR:
                return relational  ||  plus  ||  minus  ||  k == Kind.AND  ||  k == Kind.XOR  ||  power  ||  piecewise;
            case XOR:
                return relational  ||  plus  ||  minus  ||  k == Kind.AND  ||  k == Kind.OR   ||  power  ||  piecewise;
            case POWER:
                if (isLeft) return relational  ||  plus  ||  k == Kind.MINUS  ||  k == Kind.TIMES  ||  k == Kind.DIVIDE  ||  logical  ||  piecewise;
                return relational  ||  plus  ||  k == Kind.MINUS  ||  k == Kind.TIMES  ||  k == Kind.DIVIDE  ||  k == Kind.POWER  ||  k == Kind.ROOT  ||  logical  ||  piecewise;
            case ROOT:
                if (isLeft) return relational  ||  plus  ||  k == Kind.MINUS  ||  k == Kind.TIMES  ||  k == Kind.DIVIDE  ||  k == Kind.POWER  ||  k == Kind.ROOT  ||  logical  ||  piecewise;
                return relational  ||  plus  ||  k == Kind.MINUS  ||  k == Kind.TIMES  ||  k == Kind.DIVIDE  ||  logical  ||  piecewise;
            default:
                return false;
        }
    }
}

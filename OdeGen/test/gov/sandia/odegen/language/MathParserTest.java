/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

import static gov.sandia.odegen.MathML.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.odegen.eqset.EquationEntry;
import gov.sandia.odegen.eqset.VariableRegistry;
import gov.sandia.odegen.language.Operator.Kind;
import gov.sandia.odegen.model.Component;
import gov.sandia.odegen.model.Model;
import gov.sandia.odegen.model.Variable;

public class MathParserTest
{
    protected VariableRegistry registry;
    protected Component        main;
    protected MathParser       parser;

    @Before
    public void setup ()
    {
        Model model = new Model ("parser_test");
        main = model.addComponent ("main");
        for (String name : new String[] {"t", "x", "y", "a", "b", "c", "d", "e"}) main.addVariable (name, "dimensionless", null);
        registry = new VariableRegistry ();
        parser   = new MathParser (registry, main);
    }

    protected EquationEntry parse (String equation) throws ParseException
    {
        List<EquationEntry> equations = parser.parse (math (equation));
        assertEquals (1, equations.size ());
        return equations.get (0);
    }

    @Test
    public void testOneEquationPerStatement () throws ParseException
    {
        List<EquationEntry> equations = parser.parse (math (eq (ci ("x"), ci ("a")), eq (ci ("y"), ci ("b")), eq (ci ("c"), ci ("d"))));
        assertEquals (3, equations.size ());
        for (EquationEntry e : equations)
        {
            assertSame (main, e.component);
            assertEquals (Kind.EQ, e.root.kind);
        }
    }

    @Test
    public void testChain () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), apply ("plus", ci ("a"), ci ("b"), ci ("c"), ci ("d"), ci ("e"))));

        // Right-leaning: a + (b + (c + (d + e)))
        String[] names = {"a", "b", "c", "d"};
        Operator op = e.root.right;
        for (String name : names)
        {
            assertEquals (Kind.PLUS, op.kind);
            assertEquals (name, op.left.declaration.name);
            op = op.right;
        }
        assertEquals (Kind.CI, op.kind);
        assertEquals ("e", op.declaration.name);

        // Registered in document order, starting with the left-hand side.
        assertEquals (6, registry.size ());
        String[] order = {"x", "a", "b", "c", "d", "e"};
        for (int i = 0; i < order.length; i++) assertEquals (order[i], registry.get (i).variable.name);
        assertEquals (6, e.variables.size ());
        assertTrue (e.odeVariables.isEmpty ());
    }

    @Test
    public void testDerivative () throws ParseException
    {
        EquationEntry e = parse (eq (diff ("t", "x"), apply ("times", ci ("a"), ci ("x"))));

        Operator d = e.root.left;
        assertEquals (Kind.DIFF, d.kind);
        assertEquals (Kind.BVAR, d.left.kind);
        assertEquals ("t", d.left.left.declaration.name);
        assertEquals ("x", d.right.declaration.name);

        // The bound variable and the dependent variable are both ODE references.
        assertEquals (2, e.odeVariables.size ());
        assertEquals ("t", e.odeVariables.get (0).variable.name);
        assertEquals ("x", e.odeVariables.get (1).variable.name);
        assertEquals (2, e.variables.size ());
        assertEquals ("a", e.variables.get (0).variable.name);
        assertEquals ("x", e.variables.get (1).variable.name);
        assertSame (e.odeVariables.get (1), e.variables.get (1));
    }

    @Test
    public void testDegree () throws ParseException
    {
        EquationEntry e = parse (eq (diff ("t", "2", "x"), ci ("a")));
        Operator bvar = e.root.left.left;
        assertEquals (Kind.DEGREE, bvar.right.kind);
        assertEquals (2.0, bvar.right.literal (), 0);
    }

    @Test
    public void testNestedEquality () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), piecewise (piece (ci ("a"), eq (ci ("b"), ci ("c"))), otherwise (ci ("d")))));
        assertEquals (Kind.EQ, e.root.kind);

        Operator p = e.root.right;
        assertEquals (Kind.PIECEWISE, p.kind);
        assertEquals (Kind.PIECE,     p.left.kind);
        assertEquals (Kind.EQEQ,      p.left.right.kind);
        assertEquals (Kind.OTHERWISE, p.right.kind);
    }

    @Test
    public void testPiecewiseChain () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), piecewise (piece (ci ("a"), apply ("gt", ci ("a"), ci ("b"))), piece (ci ("c"), apply ("lt", ci ("c"), ci ("d"))), otherwise (ci ("e")))));
        Operator p = e.root.right;
        assertEquals (Kind.PIECEWISE, p.kind);
        assertEquals (Kind.PIECE,     p.left.kind);
        assertEquals (Kind.PIECEWISE, p.right.kind);
        assertEquals (Kind.PIECE,     p.right.left.kind);
        assertEquals (Kind.OTHERWISE, p.right.right.kind);
    }

    @Test
    public void testNumbers () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), apply ("plus", "<cn type=\"e-notation\">1.2<sep/>3</cn>", cn (" 4.5 "))));
        assertEquals ("1.2e3", e.root.right.left.value);
        assertEquals (1200.0,  e.root.right.left.literal (), 0);
        assertEquals ("4.5",   e.root.right.right.value);
    }

    @Test
    public void testConstantsAndFunctions () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), apply ("times", "<pi/>", apply ("sin", ci ("a")))));
        Operator times = e.root.right;
        assertEquals (Kind.PI,  times.left.kind);
        assertEquals (Kind.SIN, times.right.kind);
        assertNull (times.right.right);
    }

    @Test
    public void testUnsupported () throws ParseException
    {
        EquationEntry e = parse (eq (ci ("x"), apply ("plus", "<csymbol>delay</csymbol>", ci ("undeclared"))));
        Operator plus = e.root.right;
        assertEquals (Kind.PLUS, plus.kind);
        assertNull (plus.left);
        assertNull (plus.right);
        assertEquals (1, registry.size ());

        e = parse (eq (ci ("y"), apply ("arccosh_typo", ci ("a"))));
        assertNull (e.root.right);
    }

    @Test
    public void testEquivalentDeclarations () throws ParseException
    {
        Component sub = main.addComponent (new Component ("sub"));
        Variable inner = sub.addVariable ("x_inner", "dimensionless", null);
        Variable.addEquivalence (main.variable ("x"), inner);

        parse (eq (ci ("x"), ci ("a")));
        MathParser subParser = new MathParser (registry, sub);
        EquationEntry e = subParser.parse (math (eq (ci ("x_inner"), cn ("1.0")))).get (0);
        assertSame (registry.get (0), e.variables.get (0));
        assertSame (inner, e.root.left.declaration);
        assertEquals (2, registry.size ());
    }

    @Test
    public void testMalformed ()
    {
        try
        {
            parser.parse ("<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><apply>");
            fail ("Accepted malformed markup");
        }
        catch (ParseException e)
        {
        }
    }
}

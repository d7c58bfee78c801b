/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import gov.sandia.odegen.eqset.EquationEntry;
import gov.sandia.odegen.eqset.VariableRegistry;
import gov.sandia.odegen.language.Operator.Kind;
import gov.sandia.odegen.model.Component;
import gov.sandia.odegen.model.Variable;

/**
    Converts the MathML of one component into equation trees.
    Each element directly under the math root becomes one equation.
    Variable references are resolved through the registry as they are encountered, and recorded in
    the equation that contains them.
**/
public class MathParser
{
    public static final String MATHML = "http://www.w3.org/1998/Math/MathML";

    private static Logger logger = Logger.getLogger (MathParser.class);

    protected VariableRegistry registry;
    protected Component        component;
    protected EquationEntry    equation;  // currently being built

    /**
        Where a node sits relative to an enclosing derivative.
        The dependent variable of diff and the bound variable inside its bvar both count as ODE references.
    **/
    public enum Context
    {
        TOP,           // element directly under math
        NONE,
        DIFF_OPERAND,  // operand of an apply whose operator is diff
        DIFF_BVAR      // child of a bvar which is itself an operand of diff
    }

    public MathParser (VariableRegistry registry, Component component)
    {
        this.registry  = registry;
        this.component = component;
    }

    public List<EquationEntry> parse (String math) throws ParseException
    {
        Document doc;
        try
        {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
            factory.setNamespaceAware (true);
            factory.setCoalescing (true);
            factory.setIgnoringComments (true);
            DocumentBuilder builder = factory.newDocumentBuilder ();
            doc = builder.parse (new InputSource (new StringReader (math)));
        }
        catch (ParserConfigurationException e)
        {
            throw new ParseException ("XML parser is not available", e);
        }
        catch (SAXException | IOException e)
        {
            throw new ParseException (e.getMessage (), e);
        }
        return parse (doc.getDocumentElement ());
    }

    public List<EquationEntry> parse (Node math)
    {
        List<EquationEntry> result = new ArrayList<EquationEntry> ();
        for (Node child = math.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (! isMathML (child)) continue;
            equation = new EquationEntry (component);
            equation.root = process (child, Context.TOP);
            result.add (equation);
        }
        equation = null;
        return result;
    }

    public static boolean isMathML (Node node)
    {
        return node.getNodeType () == Node.ELEMENT_NODE  &&  MATHML.equals (node.getNamespaceURI ());
    }

    /**
        @return The MathML element children of the given node, in document order.
    **/
    public static List<Node> elements (Node node)
    {
        List<Node> result = new ArrayList<Node> ();
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (isMathML (child)) result.add (child);
        }
        return result;
    }

    public Operator process (Node node, Context context)
    {
        String name = node.getLocalName ();
        switch (name)
        {
            case "apply":
                return apply (node, context == Context.TOP);
            case "piecewise":
            {
                List<Node> children = elements (node);
                Operator result = new Operator (Kind.PIECEWISE);
                if (children.size () > 0) result.left  = process (children.get (0), Context.NONE);
                if (children.size () > 1) result.right = chain (Kind.PIECEWISE, children, 1, Context.NONE);
                return result;
            }
            case "piece":
            {
                List<Node> children = elements (node);
                Operator result = new Operator (Kind.PIECE);
                if (children.size () > 0) result.left  = process (children.get (0), Context.NONE);  // value
                if (children.size () > 1) result.right = process (children.get (1), Context.NONE);  // condition
                return result;
            }
            case "otherwise":
            case "degree":
            case "logbase":
            {
                List<Node> children = elements (node);
                Operator result = new Operator (Kind.forElement (name));
                if (children.size () > 0) result.left = process (children.get (0), Context.NONE);
                return result;
            }
            case "bvar":
            {
                Context inner = context == Context.DIFF_OPERAND ? Context.DIFF_BVAR : Context.NONE;
                List<Node> children = elements (node);
                Operator result = new Operator (Kind.BVAR);
                if (children.size () > 0) result.left  = process (children.get (0), inner);
                if (children.size () > 1) result.right = process (children.get (1), inner);
                return result;
            }
            case "cn":
                return number (node);
            case "ci":
                return reference (node, context);
        }

        Kind kind = Kind.forElement (name);
        if (kind == null  ||  ! kind.isConstant ())
        {
            logger.warn ("Unsupported MathML element '" + name + "' in component '" + component.name + "'");
            return null;
        }
        return new Operator (kind);
    }

    /**
        Handles an apply element. The first child gives the operator and the rest are operands.
        @param topLevel The apply sits directly under math, so an eq operator is the assignment
        of the equation rather than a comparison.
    **/
    public Operator apply (Node node, boolean topLevel)
    {
        List<Node> children = elements (node);
        if (children.isEmpty ()) return null;

        String name = children.get (0).getLocalName ();
        Kind kind = Kind.forElement (name);
        if (kind == null  ||  kind.key == null  &&  kind != Kind.DIFF)
        {
            logger.warn ("Unsupported MathML operator '" + name + "' in component '" + component.name + "'");
            return null;
        }
        if (kind == Kind.EQ  &&  ! topLevel) kind = Kind.EQEQ;

        Context context = kind == Kind.DIFF ? Context.DIFF_OPERAND : Context.NONE;
        Operator result = new Operator (kind);
        int count = children.size ();
        if (count > 1) result.left  = process (children.get (1), context);
        if (count > 2) result.right = chain (kind, children, 2, context);
        return result;
    }

    /**
        Builds the right-leaning chain for operands start through the last one.
        Operands are processed in document order, so variables are registered in the order they appear.
    **/
    public Operator chain (Kind kind, List<Node> children, int start, Context context)
    {
        List<Operator> operands = new ArrayList<Operator> ();
        for (int i = start; i < children.size (); i++) operands.add (process (children.get (i), context));

        int last = operands.size () - 1;
        Operator result = operands.get (last);
        for (int i = last - 1; i >= 0; i--) result = new Operator (kind, operands.get (i), result);
        return result;
    }

    public Operator number (Node node)
    {
        Operator result = new Operator (Kind.CN);
        Node sep = null;
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (isMathML (child)  &&  child.getLocalName ().equals ("sep")) sep = child;
        }
        if (sep == null)
        {
            result.value = node.getTextContent ().trim ();
        }
        else  // e-notation: mantissa <sep/> exponent
        {
            StringBuilder mantissa = new StringBuilder ();
            StringBuilder exponent = new StringBuilder ();
            StringBuilder current  = mantissa;
            for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
            {
                if (child == sep) current = exponent;
                else if (child.getNodeType () == Node.TEXT_NODE) current.append (child.getNodeValue ());
            }
            result.value = mantissa.toString ().trim () + "e" + exponent.toString ().trim ();
        }
        return result;
    }

    public Operator reference (Node node, Context context)
    {
        String name = node.getTextContent ().trim ();
        Variable v = component.variable (name);
        if (v == null)
        {
            logger.warn ("Variable '" + name + "' is not declared in component '" + component.name + "'");
            return null;
        }

        Operator result = new Operator (Kind.CI);
        result.declaration = v;
        result.variable    = registry.entry (v);
        if (context == Context.DIFF_OPERAND  ||  context == Context.DIFF_BVAR) equation.addOdeVariable (result.variable);
        else                                                                   equation.addVariable    (result.variable);
        return result;
    }
}

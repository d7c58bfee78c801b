/*
Copyright 2013-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.eqset;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.odegen.eqset.VariableEntry.Role;
import gov.sandia.odegen.language.MathParser;
import gov.sandia.odegen.language.Operator;
import gov.sandia.odegen.language.Operator.Kind;
import gov.sandia.odegen.language.ParseException;
import gov.sandia.odegen.model.Component;
import gov.sandia.odegen.model.Model;
import gov.sandia.odegen.model.Variable;

/**
    All the equations of a model, collected from its whole encapsulation tree, together with the
    variables they reference. Analysis proceeds in stages:
    <ol>
    <li>build() parses the math of every component and reconciles initial values across equivalent variables.
    <li>checkStructure() finds the integration variable, the states, and any derivative that is not first order.
    <li>indexConstants() and determineOrder() decide which equation computes which variable, and in what order.
    <li>checkRoles() reports any variable that ended up without a usable role.
    </ol>
    Problems are collected in issues rather than thrown. Each stage after build() should only run
    if no issues have been found so far; analyze() takes care of that.
**/
public class EquationSet
{
    private static Logger logger = Logger.getLogger (EquationSet.class);

    public Model               model;
    public VariableRegistry    registry            = new VariableRegistry ();
    public List<EquationEntry> equations           = new ArrayList<EquationEntry> ();  // in document order
    public List<Issue>         issues              = new ArrayList<Issue> ();
    public Variable            integrationVariable;  // declaration that first appeared as the bound variable of a derivative

    protected int equationOrder;
    protected int stateIndex;
    protected int variableIndex;

    public EquationSet (Model model)
    {
        this.model = model;
    }

    /**
        Runs every stage, skipping those that can't proceed because of earlier issues.
    **/
    public void analyze ()
    {
        build ();
        if (issues.isEmpty ()) checkStructure ();
        indexConstants ();
        if (issues.isEmpty ()) determineOrder ();
        if (issues.isEmpty ()) checkRoles ();
    }

    public void build ()
    {
        for (Component c : model.components) build (c);
    }

    public void build (Component c)
    {
        if (c.math != null  &&  ! c.math.trim ().isEmpty ())
        {
            MathParser parser = new MathParser (registry, c);
            try
            {
                equations.addAll (parser.parse (c.math));
            }
            catch (ParseException e)
            {
                issues.add (new Issue ("The math in component '" + c.name + "' of model '" + modelName (c) + "' could not be read: " + e.getMessage (), Issue.Kind.MATHML));
            }
        }

        // Only one of a set of equivalent variables may carry the initial value.
        for (Variable v : c.variables)
        {
            VariableEntry entry = registry.entry (v);
            if (v.isInitialised ()  &&  ! entry.variable.isInitialised ())
            {
                entry.initialise (v);
            }
            else if (v != entry.variable  &&  v.isInitialised ()  &&  entry.variable.isInitialised ())
            {
                error (describe (v) + " and " + uncapitalize (describe (entry.variable)) + " are equivalent and cannot therefore both be initialised.");
            }
        }

        for (Component child : c.components) build (child);
    }

    public void checkStructure ()
    {
        for (EquationEntry e : equations) checkStructure (e.root, null, null, null);
    }

    /**
        Walks the tree with its three nearest ancestors at hand.
    **/
    public void checkStructure (Operator op, Operator parent, Operator grandparent, Operator greatGrandparent)
    {
        if (op == null) return;

        if (op.kind == Kind.CI  &&  is (parent, Kind.BVAR)  &&  is (grandparent, Kind.DIFF))
        {
            // Mark in all cases, even on conflict, so the variable doesn't also get reported as unknown.
            Variable v = op.declaration;
            op.variable.makeIntegrationVariable ();
            if (integrationVariable == null)
            {
                if (v.isInitialised ()) error (describe (v) + " cannot be both a variable of integration and initialised.");
                else                    integrationVariable = v;
            }
            else if (v != integrationVariable  &&  ! v.hasEquivalentVariable (integrationVariable))
            {
                error (describe (integrationVariable) + " and " + uncapitalize (describe (v)) + " cannot both be a variable of integration.");
            }
        }

        if (op.kind == Kind.CN  &&  is (parent, Kind.DEGREE)  &&  is (grandparent, Kind.BVAR)  &&  is (greatGrandparent, Kind.DIFF))
        {
            if (op.literal () != 1.0)
            {
                Operator dependent = greatGrandparent.right;
                if (dependent != null  &&  dependent.declaration != null)
                {
                    error ("The differential equation for " + uncapitalize (describe (dependent.declaration)) + " must be of the first order.");
                }
                else
                {
                    logger.warn ("Derivative of degree " + op.value + " is not taken of a variable, so its order cannot be checked: " + greatGrandparent);
                }
            }
        }

        if (op.kind == Kind.CI  &&  is (parent, Kind.DIFF)) op.variable.makeState ();

        checkStructure (op.left,  op, parent, grandparent);
        checkStructure (op.right, op, parent, grandparent);
    }

    /**
        Constants never need an equation, so they are numbered first, in registry order.
    **/
    public void indexConstants ()
    {
        variableIndex = 0;
        for (VariableEntry v : registry.entries)
        {
            if (v.role == Role.CONSTANT) v.assignIndex (variableIndex++);
        }
    }

    /**
        Repeatedly sweeps the equations in document order until a sweep resolves nothing.
        Terminates because each productive sweep marks at least one more variable as computed.
    **/
    public void determineOrder ()
    {
        equationOrder = 0;
        stateIndex    = 0;
        int pass = 0;
        boolean progress = true;
        while (progress)
        {
            progress = false;
            pass++;
            for (EquationEntry e : equations)
            {
                if (e.check (this)) progress = true;
            }
            logger.debug ("pass " + pass + ": " + equationOrder + " of " + equations.size () + " equations ordered");
        }

        for (EquationEntry e : equations)
        {
            if (e.order == 0) logger.warn ("Equation in component '" + e.component.name + "' does not determine any variable, so it is ignored: " + e.root);
        }
    }

    public void checkRoles ()
    {
        for (VariableEntry v : registry.entries)
        {
            switch (v.role)
            {
                case UNKNOWN:
                    error (describe (v.variable) + " is of unknown type.");
                    break;
                case SHOULD_BE_STATE:
                    error (describe (v.variable) + " is used in an ODE, but it is not initialised.");
                    break;
                default:
                    break;
            }
        }
    }

    public int stateCount ()
    {
        int result = 0;
        for (VariableEntry v : registry.entries) if (v.isState ()) result++;
        return result;
    }

    public int variableCount ()
    {
        int result = 0;
        for (VariableEntry v : registry.entries) if (v.isVariable ()) result++;
        return result;
    }

    /**
        @return Equations of the given type, in evaluation order.
    **/
    public List<EquationEntry> ordered (EquationEntry.Type type)
    {
        List<EquationEntry> result = new ArrayList<EquationEntry> ();
        for (EquationEntry e : equations) if (e.type == type) result.add (e);
        result.sort (Comparator.comparingInt (e -> e.order));
        return result;
    }

    /**
        @return Entries that occupy the states array (states true) or the variables array (states false), sorted by index.
    **/
    public List<VariableEntry> indexed (boolean states)
    {
        List<VariableEntry> result = new ArrayList<VariableEntry> ();
        for (VariableEntry v : registry.entries)
        {
            if (states ? v.isState () : v.isVariable ()) result.add (v);
        }
        result.sort (Comparator.comparingInt (v -> v.index));
        return result;
    }

    protected void error (String description)
    {
        logger.debug (description);
        issues.add (new Issue (description, Issue.Kind.GENERATOR));
    }

    protected static boolean is (Operator op, Kind kind)
    {
        return op != null  &&  op.kind == kind;
    }

    public static String modelName (Component c)
    {
        Model m = c.getModel ();
        if (m == null) return "";
        return m.name;
    }

    /**
        Standard way to name a variable in messages.
    **/
    public static String describe (Variable v)
    {
        return "Variable '" + v.name + "' in component '" + v.component.name + "' of model '" + modelName (v.component) + "'";
    }

    protected static String uncapitalize (String description)
    {
        return Character.toLowerCase (description.charAt (0)) + description.substring (1);
    }
}

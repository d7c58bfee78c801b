/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.eqset;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.odegen.eqset.VariableEntry.Role;
import gov.sandia.odegen.language.Operator;
import gov.sandia.odegen.model.Component;

/**
    One equation of a component, along with the variables it still has to account for.
    The reference lists shrink as causalization discovers which variables are already known.
**/
public class EquationEntry
{
    private static Logger logger = Logger.getLogger (EquationEntry.class);

    public enum Type
    {
        UNKNOWN,
        TRUE_CONSTANT,
        VARIABLE_BASED_CONSTANT,
        RATE,
        ALGEBRAIC
    }

    /**
        Ordered from least to most constant, so the combined constancy of an equation is the minimum over its references.
    **/
    public enum Constancy
    {
        NON_CONSTANT,
        VARIABLE_BASED_CONSTANT,
        TRUE_CONSTANT;

        public Constancy min (Constancy that)
        {
            if (that.ordinal () < ordinal ()) return that;
            return this;
        }
    }

    public Component           component;
    public Operator            root;
    public List<VariableEntry> variables    = new ArrayList<VariableEntry> ();  // plain references
    public List<VariableEntry> odeVariables = new ArrayList<VariableEntry> ();  // references under a derivative
    public Constancy           constancy    = Constancy.TRUE_CONSTANT;
    public Type                type         = Type.UNKNOWN;
    public int                 order;       // 1-based evaluation order; 0 means not resolved
    public VariableEntry       solves;      // the variable this equation computes, once resolved

    public EquationEntry (Component component)
    {
        this.component = component;
    }

    public void addVariable (VariableEntry v)
    {
        if (! variables.contains (v)) variables.add (v);
    }

    public void addOdeVariable (VariableEntry v)
    {
        if (! odeVariables.contains (v)) odeVariables.add (v);
    }

    protected VariableEntry single ()
    {
        if (variables.size () == 1) return variables.get (0);
        return odeVariables.get (0);
    }

    /**
        One step of causalization for this equation.
        Drops references whose value is already available. If exactly one remains, this equation
        computes it: the variable gets its role (if it had none), its index and the computed flag,
        and the equation gets its type and the next order number.
        @return true if the equation was resolved during this call.
    **/
    public boolean check (EquationSet s)
    {
        if (order != 0) return false;
        if (variables.size () + odeVariables.size () == 1  &&  single ().role != Role.UNKNOWN) return false;  // over-constrained

        for (VariableEntry v : variables)    constancy = constancy.min (v.constancy ());
        for (VariableEntry v : odeVariables) constancy = constancy.min (v.constancy ());

        variables   .removeIf (VariableEntry::isKnown);
        odeVariables.removeIf (VariableEntry::isKnownOde);
        if (variables.size () + odeVariables.size () != 1) return false;

        VariableEntry v = single ();
        if (v.role == Role.UNKNOWN)
        {
            switch (constancy)
            {
                case TRUE_CONSTANT:           v.role = Role.COMPUTED_TRUE_CONSTANT;           break;
                case VARIABLE_BASED_CONSTANT: v.role = Role.COMPUTED_VARIABLE_BASED_CONSTANT; break;
                default:                      v.role = Role.ALGEBRAIC;
            }
        }

        switch (v.role)
        {
            case STATE:
                v.assignIndex (s.stateIndex++);
                type = Type.RATE;
                break;
            case COMPUTED_TRUE_CONSTANT:
                v.assignIndex (s.variableIndex++);
                type = Type.TRUE_CONSTANT;
                break;
            case COMPUTED_VARIABLE_BASED_CONSTANT:
                v.assignIndex (s.variableIndex++);
                type = Type.VARIABLE_BASED_CONSTANT;
                break;
            case ALGEBRAIC:
                v.assignIndex (s.variableIndex++);
                type = Type.ALGEBRAIC;
                break;
            default:
                return false;
        }
        v.computed = true;
        solves     = v;
        order      = ++s.equationOrder;
        if (logger.isDebugEnabled ()) logger.debug ("order " + order + ": " + type + " equation in '" + component.name + "' computes " + v + " (" + v.role + ", index " + v.index + ")");
        return true;
    }

    public String toString ()
    {
        return component.name + ": " + root;
    }
}

/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.eqset;

import gov.sandia.odegen.eqset.EquationEntry.Constancy;
import gov.sandia.odegen.model.Variable;

/**
    Canonical record for a set of equivalent variables.
    All equations refer to this rather than to the individual declarations.
**/
public class VariableEntry
{
    public enum Role
    {
        UNKNOWN,
        SHOULD_BE_STATE,  // appears under a derivative but has no initial value (yet)
        INTEGRATION_VARIABLE,
        STATE,
        CONSTANT,
        COMPUTED_TRUE_CONSTANT,
        COMPUTED_VARIABLE_BASED_CONSTANT,
        ALGEBRAIC
    }

    public int      handle;    // position in the registry
    public Variable variable;  // representative declaration, which supplies the initial value and the name in messages
    public Role     role  = Role.UNKNOWN;
    public int      index = -1;
    public boolean  computed;

    public VariableEntry (int handle, Variable variable)
    {
        this.handle = handle;
        initialise (variable);
    }

    /**
        Makes the given declaration the representative.
        If it carries an initial value, then this is either a constant or (if already seen under a derivative) a state.
    **/
    public void initialise (Variable v)
    {
        variable = v;
        if (! v.isInitialised ()) return;
        if      (role == Role.UNKNOWN)         role = Role.CONSTANT;
        else if (role == Role.SHOULD_BE_STATE) role = Role.STATE;
    }

    public void makeState ()
    {
        if      (role == Role.UNKNOWN)  role = Role.SHOULD_BE_STATE;
        else if (role == Role.CONSTANT) role = Role.STATE;
    }

    public void makeIntegrationVariable ()
    {
        role = Role.INTEGRATION_VARIABLE;
    }

    public void assignIndex (int value)
    {
        if (index >= 0) throw new IllegalStateException ("Index already assigned to " + variable);
        index = value;
    }

    public boolean isState ()
    {
        return role == Role.STATE;
    }

    /**
        Counts toward the shared variables array.
    **/
    public boolean isVariable ()
    {
        switch (role)
        {
            case CONSTANT:
            case COMPUTED_TRUE_CONSTANT:
            case COMPUTED_VARIABLE_BASED_CONSTANT:
            case ALGEBRAIC:
                return true;
            default:
                return false;
        }
    }

    /**
        The most an equation that references this variable can be.
        A variable that has no role yet imposes no restriction, and only a declared constant keeps
        the equation variable-based. Any computed variable makes it non-constant.
    **/
    public Constancy constancy ()
    {
        switch (role)
        {
            case UNKNOWN:
                return Constancy.TRUE_CONSTANT;
            case CONSTANT:
                return Constancy.VARIABLE_BASED_CONSTANT;
            default:
                return Constancy.NON_CONSTANT;
        }
    }

    /**
        Value is available when evaluating an ordinary reference.
    **/
    public boolean isKnown ()
    {
        return computed  ||  role == Role.INTEGRATION_VARIABLE  ||  role == Role.STATE  ||  role == Role.CONSTANT;
    }

    /**
        Value is available when evaluating a reference under a derivative.
        A state is only known there once its rate has been computed.
    **/
    public boolean isKnownOde ()
    {
        return computed  ||  role == Role.INTEGRATION_VARIABLE;
    }

    public String toString ()
    {
        return variable.toString ();
    }
}

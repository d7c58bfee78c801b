/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
    A named quantity declared in a component.
    Equivalence links are symmetric, and the relation is closed transitively when queried.
**/
public class Variable
{
    public String         name;
    public String         units;
    public String         initialValue;  // Literal text, or null if not initialised
    public Component      component;
    public List<Variable> equivalents = new ArrayList<Variable> ();  // Direct links only

    public Variable (String name)
    {
        this.name = name;
    }

    public Variable (String name, String units, String initialValue)
    {
        this.name         = name;
        this.units        = units;
        this.initialValue = initialValue;
    }

    public boolean isInitialised ()
    {
        return initialValue != null  &&  ! initialValue.isEmpty ();
    }

    public static void addEquivalence (Variable a, Variable b)
    {
        if (a == b) return;
        if (! a.equivalents.contains (b)) a.equivalents.add (b);
        if (! b.equivalents.contains (a)) b.equivalents.add (a);
    }

    /**
        Determines if the given variable is reachable through any chain of equivalence links.
        A variable is never considered equivalent to itself.
    **/
    public boolean hasEquivalentVariable (Variable other)
    {
        if (other == this) return false;
        Set<Variable>        visited = new HashSet<Variable> ();
        LinkedList<Variable> queue   = new LinkedList<Variable> ();
        visited.add (this);
        queue.addAll (equivalents);
        while (! queue.isEmpty ())
        {
            Variable v = queue.removeFirst ();
            if (v == other) return true;
            if (! visited.add (v)) continue;
            queue.addAll (v.equivalents);
        }
        return false;
    }

    public String toString ()
    {
        if (component == null) return name;
        return component.name + "." + name;
    }
}

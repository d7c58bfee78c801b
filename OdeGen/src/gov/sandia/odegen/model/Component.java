/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.model;

import java.util.ArrayList;
import java.util.List;

public class Component
{
    public String          name;
    public String          math;  // MathML document text with a single math root, or null
    public Model           model;
    public Component       parent;
    public List<Variable>  variables  = new ArrayList<Variable> ();
    public List<Component> components = new ArrayList<Component> ();  // encapsulated children, in document order

    public Component (String name)
    {
        this.name = name;
    }

    public Variable addVariable (Variable v)
    {
        v.component = this;
        variables.add (v);
        return v;
    }

    public Variable addVariable (String name, String units, String initialValue)
    {
        return addVariable (new Variable (name, units, initialValue));
    }

    public Variable variable (String name)
    {
        for (Variable v : variables) if (v.name.equals (name)) return v;
        return null;
    }

    public Component addComponent (Component child)
    {
        child.parent = this;
        child.model  = model;
        components.add (child);
        return child;
    }

    /**
        The model that owns this component, found through the encapsulation hierarchy.
    **/
    public Model getModel ()
    {
        Component c = this;
        while (c.parent != null) c = c.parent;
        return c.model;
    }

    public String toString ()
    {
        return name;
    }
}

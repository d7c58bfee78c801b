/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.model;

import java.util.ArrayList;
import java.util.List;

/**
    Root of the component tree. Only top-level components are held directly.
    The rest are reached through encapsulation.
**/
public class Model
{
    public String          name;
    public List<Component> components = new ArrayList<Component> ();

    public Model (String name)
    {
        this.name = name;
    }

    public Component addComponent (Component c)
    {
        c.model  = this;
        c.parent = null;
        components.add (c);
        return c;
    }

    public Component addComponent (String name)
    {
        return addComponent (new Component (name));
    }

    /**
        Depth-first search of the whole encapsulation tree.
    **/
    public Component component (String name)
    {
        return component (name, components);
    }

    protected static Component component (String name, List<Component> list)
    {
        for (Component c : list)
        {
            if (c.name.equals (name)) return c;
            Component result = component (name, c.components);
            if (result != null) return result;
        }
        return null;
    }

    public String toString ()
    {
        return name;
    }
}

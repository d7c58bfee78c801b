/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.eqset;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gov.sandia.odegen.model.Variable;

/**
    Collapses equivalent declarations into a single VariableEntry.
    Entries are held in the order they were first seen, and a handle is a position in that list.
**/
public class VariableRegistry
{
    public    List<VariableEntry>    entries = new ArrayList<VariableEntry> ();
    protected Map<Variable,Integer>  handles = new HashMap<Variable,Integer> ();

    /**
        Finds the canonical record for the given declaration, creating it on first sight.
    **/
    public VariableEntry entry (Variable v)
    {
        Integer handle = handles.get (v);
        if (handle != null) return entries.get (handle);

        for (VariableEntry e : entries)
        {
            if (e.variable.hasEquivalentVariable (v))
            {
                handles.put (v, e.handle);
                return e;
            }
        }

        VariableEntry result = new VariableEntry (entries.size (), v);
        entries.add (result);
        handles.put (v, result.handle);
        return result;
    }

    public VariableEntry get (int handle)
    {
        return entries.get (handle);
    }

    public int size ()
    {
        return entries.size ();
    }
}

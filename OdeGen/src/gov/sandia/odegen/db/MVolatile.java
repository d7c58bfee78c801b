/*
Copyright 2016-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
    In-memory MNode. Children keep the order in which they were first set, so a document
    written back out lists its keys the way it was read.
**/
public class MVolatile extends MNode
{
    protected String            name;
    protected String            value;
    protected Map<String,MNode> children;  // created on first use

    public MVolatile ()
    {
    }

    public MVolatile (String value, String name)
    {
        this.name  = name;
        this.value = value;
    }

    public String key ()
    {
        if (name == null) return "";
        return name;
    }

    protected synchronized MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public synchronized void clear ()
    {
        if (children != null) children.clear ();
    }

    public synchronized int size ()
    {
        if (children == null) return 0;
        return children.size ();
    }

    public synchronized boolean data ()
    {
        return value != null;
    }

    public synchronized String getOrDefault (String defaultValue)
    {
        if (value == null  ||  value.isEmpty ()) return defaultValue;
        return value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new LinkedHashMap<String,MNode> ();
        MNode result = children.get (key);
        if (result == null)
        {
            result = new MVolatile (value, key);
            children.put (key, result);
        }
        else
        {
            result.set (value);
        }
        return result;
    }

    /**
        Iterates over a snapshot of the children, so the tree may be modified during iteration.
    **/
    public synchronized Iterator<MNode> iterator ()
    {
        if (children == null) return Collections.emptyIterator ();
        return new ArrayList<MNode> (children.values ()).iterator ();
    }
}

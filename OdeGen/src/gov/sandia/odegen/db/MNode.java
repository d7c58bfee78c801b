/*
Copyright 2016-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.db;

import java.io.StringWriter;
import java.util.Collections;
import java.util.Iterator;

/**
    A tree of string values addressed by key paths, for example get ("operator", "plus").
    This base class is an empty, read-only node. Subclasses supply storage.

    A node may exist without a value ("undefined"). For reading, that is the same as a value of "".
    Use data() to tell the two apart.
**/
public class MNode implements Iterable<MNode>
{
    public String key ()
    {
        return "";
    }

    /**
        Single-level lookup that subclasses override. Everything else is built on it.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Follows the given path down the tree.
        @return The node at the end of the path, or null if any step is missing. With no keys, this node.
    **/
    public MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            result = result.getChild (key);
            if (result == null) return null;
        }
        return result;
    }

    /**
        Same as child(String...), except that missing steps are created as undefined nodes.
    **/
    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode next = result.getChild (key);
            if (next == null) next = result.set (null, key);
            result = next;
        }
        return result;
    }

    public void clear ()
    {
    }

    public int size ()
    {
        return 0;
    }

    /**
        @return true if this node holds a value, even an empty one.
    **/
    public boolean data ()
    {
        return false;
    }

    public String get ()
    {
        return getOrDefault ("");
    }

    /**
        @return The value at the end of the path, or "" if the path doesn't exist.
    **/
    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        @return This node's value, or the given default if the value is undefined or empty.
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    /**
        A flag is on if its node exists with any value other than "0". An empty value counts as on.
    **/
    public boolean getFlag (String... keys)
    {
        MNode c = child (keys);
        return c != null  &&  ! c.get ().equals ("0");
    }

    /**
        Sets this node's own value. null makes it undefined.
    **/
    public void set (String value)
    {
    }

    /**
        Sets the value of a direct child, creating it if needed.
        @return The child.
    **/
    public MNode set (String value, String key)
    {
        throw new UnsupportedOperationException ("Read-only node");
    }

    /**
        Sets the value at the end of the path, creating any missing nodes along the way.
        @return The node that received the value.
    **/
    public synchronized MNode set (String value, String... keys)
    {
        MNode result = childOrCreate (keys);
        result.set (value);
        return result;
    }

    public Iterator<MNode> iterator ()
    {
        return Collections.emptyIterator ();
    }

    /**
        Compares values and the whole subtree below, but not the keys of the two nodes themselves.
    **/
    public boolean equalsRecursive (MNode that)
    {
        if (data () != that.data ()  ||  ! get ().equals (that.get ())) return false;
        if (size () != that.size ()) return false;
        for (MNode a : this)
        {
            MNode b = that.getChild (a.key ());
            if (b == null  ||  ! a.equalsRecursive (b)) return false;
        }
        return true;
    }

    @Override
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof MNode)) return false;
        MNode that = (MNode) o;
        return key ().equals (that.key ())  &&  equalsRecursive (that);
    }

    @Override
    public int hashCode ()
    {
        return key ().hashCode ();
    }

    /**
        The subtree in its serialized form.
    **/
    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        Schema.latest ().write (this, writer);
        return writer.toString ();
    }
}

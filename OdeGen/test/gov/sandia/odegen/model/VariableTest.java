/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class VariableTest
{
    @Test
    public void testEquivalence ()
    {
        Model     m     = new Model ("m");
        Component main  = m.addComponent ("main");
        Component sub   = main.addComponent (new Component ("sub"));
        Component other = m.addComponent ("other");

        Variable a = main .addVariable ("a", "second", null);
        Variable b = sub  .addVariable ("a", "second", null);
        Variable c = other.addVariable ("c", "second", "0.0");
        Variable d = other.addVariable ("d", "second", null);

        assertFalse (a.hasEquivalentVariable (a));
        assertFalse (a.hasEquivalentVariable (b));

        Variable.addEquivalence (a, b);
        Variable.addEquivalence (b, c);
        assertTrue  (a.hasEquivalentVariable (b));
        assertTrue  (b.hasEquivalentVariable (a));
        assertTrue  (a.hasEquivalentVariable (c));  // transitive
        assertTrue  (c.hasEquivalentVariable (a));
        assertFalse (a.hasEquivalentVariable (d));
        assertFalse (a.hasEquivalentVariable (a));  // even though links lead back to it

        assertTrue  (c.isInitialised ());
        assertFalse (a.isInitialised ());
        assertEquals ("sub.a", b.toString ());
    }

    @Test
    public void testHierarchy ()
    {
        Model     m      = new Model ("m");
        Component top    = m.addComponent ("top");
        Component middle = top.addComponent (new Component ("middle"));
        Component bottom = middle.addComponent (new Component ("bottom"));

        assertSame (m,      bottom.getModel ());
        assertSame (middle, bottom.parent);
        assertSame (bottom, m.component ("bottom"));
        assertNull (m.component ("missing"));
        assertEquals (1, m.components.size ());

        Variable v = bottom.addVariable ("v", "dimensionless", "1.0");
        assertSame (bottom, v.component);
        assertSame (v, bottom.variable ("v"));
        assertNull (bottom.variable ("w"));
    }
}

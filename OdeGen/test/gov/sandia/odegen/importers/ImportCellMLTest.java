/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.importers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Test;

import gov.sandia.odegen.backend.Generator;
import gov.sandia.odegen.model.Component;
import gov.sandia.odegen.model.Model;

public class ImportCellMLTest
{
    public static Model load (String name) throws ImportException, IOException
    {
        try (InputStream stream = ImportCellMLTest.class.getResourceAsStream (name))
        {
            if (stream == null) throw new IOException ("Missing test resource " + name);
            return new ImportCellML ().process (stream);
        }
    }

    public static Model parse (String text) throws ImportException
    {
        return new ImportCellML ().process (new ByteArrayInputStream (text.getBytes (StandardCharsets.UTF_8)));
    }

    @Test
    public void testVanDerPol () throws Exception
    {
        Model model = load ("van_der_pol.cellml");
        assertEquals ("van_der_pol_model_1928", model.name);
        assertEquals (1, model.components.size ());

        Component main = model.components.get (0);
        assertEquals (4, main.variables.size ());
        assertEquals ("-2.0", main.variable ("x").initialValue);
        assertNull (main.variable ("t").initialValue);
        assertEquals ("second", main.variable ("t").units);
        assertTrue (main.math.contains ("http://www.w3.org/1998/Math/MathML"));

        // Both math elements end up in one document, and the units prefix on cn still resolves.
        Generator generator = new Generator ();
        generator.process (model);
        assertEquals (0, generator.errorCount ());
        assertEquals (2, generator.stateCount ());
        assertEquals ("states[0] = -2.0;\nstates[1] = 0.0;\nvariables[0] = 1.0;\n", generator.initializeVariables ());
        assertEquals
        (
            "rates[0] = states[1]*1.0;\n"
            + "rates[1] = (variables[0]*(1.0-sqr(states[0]))*states[1]-states[0])*1.0;\n",
            generator.computeRateEquations ()
        );
    }

    @Test
    public void testGroupEncapsulation () throws Exception
    {
        Model model = load ("nested.cellml");
        assertEquals (1, model.components.size ());
        Component main       = model.components.get (0);
        Component parameters = model.component ("parameters");
        assertSame (main, parameters.parent);
        assertSame (model, parameters.getModel ());
        assertTrue (main.variable ("k").hasEquivalentVariable (parameters.variable ("k")));

        Generator generator = new Generator ();
        generator.process (model);
        assertEquals (0, generator.errorCount ());
        assertEquals ("states[0] = 1.0;\nvariables[0] = 3.0;\n", generator.initializeVariables ());
        assertEquals ("rates[0] = variables[0];\n", generator.computeRateEquations ());
        assertEquals (Arrays.asList ("parameters.k"), generator.variableNames ());
    }

    @Test
    public void testEncapsulation () throws Exception
    {
        Model model = load ("environment.cellml");
        assertEquals (2, model.components.size ());
        assertEquals ("environment", model.components.get (0).name);
        assertEquals ("membrane",    model.components.get (1).name);
        Component current = model.component ("current");
        assertSame (model.components.get (1), current.parent);

        Generator generator = new Generator ();
        generator.process (model);
        assertEquals (0, generator.errorCount ());
        assertEquals (Generator.ModelType.ODE, generator.modelType ());
        assertEquals ("states[0] = -75.0;\nvariables[0] = 0.3;\nvariables[1] = -54.4;\n", generator.initializeVariables ());
        assertEquals ("rates[0] = -variables[2];\n", generator.computeRateEquations ());
        assertEquals ("variables[2] = variables[0]*(states[0]-variables[1]);\n", generator.computeAlgebraicEquations ());
        assertEquals (Arrays.asList ("membrane.V"), generator.stateNames ());
        assertEquals (Arrays.asList ("current.g", "current.E", "membrane.i_ion"), generator.variableNames ());
    }

    @Test
    public void testErrors ()
    {
        String[] bad =
        {
            "<model",
            "<notamodel/>",
            "<model xmlns=\"http://www.cellml.org/cellml/2.0#\" name=\"m\"><component name=\"a\"/><component name=\"a\"/></model>",
            "<model xmlns=\"http://www.cellml.org/cellml/2.0#\" name=\"m\"><encapsulation><component_ref component=\"missing\"/></encapsulation></model>",
            "<model xmlns=\"http://www.cellml.org/cellml/2.0#\" name=\"m\"><component name=\"a\"/><component name=\"b\"/>"
                + "<connection component_1=\"a\" component_2=\"b\"><map_variables variable_1=\"x\" variable_2=\"y\"/></connection></model>"
        };
        for (String text : bad)
        {
            try
            {
                parse (text);
                fail ("Accepted bad CellML: " + text);
            }
            catch (ImportException e)
            {
            }
        }
    }
}

/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder ();

    protected ByteArrayOutputStream out;
    protected ByteArrayOutputStream err;

    @Before
    public void setup ()
    {
        out = new ByteArrayOutputStream ();
        err = new ByteArrayOutputStream ();
    }

    public int run (String... args)
    {
        return Main.run (args, new PrintStream (out, true), new PrintStream (err, true));
    }

    public static String fixture (String name) throws Exception
    {
        return Paths.get (MainTest.class.getResource ("importers/" + name).toURI ()).toString ();
    }

    @Test
    public void testStandardOutput () throws Exception
    {
        assertEquals (0, run ("-model=" + fixture ("van_der_pol.cellml")));
        String code = out.toString (StandardCharsets.UTF_8.name ());
        assertTrue (code.startsWith ("#include <math.h>"));
        assertTrue (code.contains ("double sqr(double x)"));
        assertTrue (code.contains ("    rates[0] = states[1]*1.0;\n"));
    }

    @Test
    public void testOutputFile () throws Exception
    {
        File output = new File (folder.getRoot (), "model.py");
        assertEquals (0, run ("-model=" + fixture ("nested.cellml"), "-profile=Python", "-output=" + output.getPath ()));
        String code = new String (Files.readAllBytes (output.toPath ()), StandardCharsets.UTF_8);
        assertTrue (code.startsWith ("from math import *\n"));
        assertTrue (code.contains ("def compute_rates(voi, states, rates, variables):\n    rates[0] = variables[0]\n"));
        assertEquals (0, out.size ());
    }

    @Test
    public void testProfileFile () throws Exception
    {
        Path profile = folder.newFile ("custom.profile").toPath ();
        String text =
            "OdeGen.schema=1,profile\n"
            + "operator\n"
            + " eq:\" := \"\n"
            + " times:\" * \"\n"
            + "array\n"
            + " voi:t\n"
            + " states:s\n"
            + " rates:r\n"
            + " variables:v\n"
            + "file\n"
            + " rates:|\n"
            + "  rates\n"
            + "  #code\n";
        Files.write (profile, text.getBytes (StandardCharsets.UTF_8));
        assertEquals (0, run ("-model=" + fixture ("nested.cellml"), "-profile=" + profile));
        String code = out.toString (StandardCharsets.UTF_8.name ());
        assertTrue (code.contains ("rates\nr[0] := v[0]\n"));
    }

    @Test
    public void testErrors () throws Exception
    {
        assertEquals (1, run ());
        assertEquals (1, run ("-bogus"));
        assertEquals (1, run ("-model=" + folder.getRoot () + "/missing.cellml"));

        File broken = folder.newFile ("broken.cellml");
        String text =
            "<model xmlns=\"http://www.cellml.org/cellml/2.0#\" name=\"broken\">"
            + "<component name=\"main\"><variable name=\"a\" units=\"dimensionless\"/><variable name=\"b\" units=\"dimensionless\"/>"
            + "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><apply><eq/><ci>a</ci><apply><plus/><ci>b</ci><cn>1</cn></apply></apply></math>"
            + "</component></model>";
        Files.write (broken.toPath (), text.getBytes (StandardCharsets.UTF_8));
        err.reset ();
        assertEquals (1, run ("-model=" + broken.getPath ()));
        assertTrue (err.toString (StandardCharsets.UTF_8.name ()).contains ("is of unknown type."));
    }
}

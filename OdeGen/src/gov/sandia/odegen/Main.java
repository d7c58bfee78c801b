/*
Copyright 2013-2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import gov.sandia.odegen.backend.Generator;
import gov.sandia.odegen.backend.Profile;
import gov.sandia.odegen.eqset.Issue;
import gov.sandia.odegen.importers.ImportCellML;
import gov.sandia.odegen.importers.ImportException;
import gov.sandia.odegen.model.Model;

/**
    Command-line entry point.
    Usage: -model=file.cellml [-profile=C|Python|file.profile] [-output=file] [-verbose]
**/
public class Main
{
    public static void main (String[] args)
    {
        int exitCode = run (args, System.out, System.err);
        if (exitCode != 0) System.exit (exitCode);
    }

    public static int run (String[] args, PrintStream out, PrintStream err)
    {
        Path   modelPath   = null;
        String profileName = Profile.C;
        Path   outputPath  = null;
        for (String arg : args)
        {
            if      (arg.startsWith ("-model="  )) modelPath   = Paths.get (arg.substring (7));
            else if (arg.startsWith ("-profile=")) profileName = arg.substring (9);
            else if (arg.startsWith ("-output=" )) outputPath  = Paths.get (arg.substring (8));
            else if (arg.equals     ("-verbose" )) Logger.getLogger ("gov.sandia.odegen").setLevel (Level.DEBUG);
            else
            {
                err.println ("Unrecognized argument: " + arg);
                return 1;
            }
        }
        if (modelPath == null)
        {
            err.println ("Usage: -model=file.cellml [-profile=C|Python|file.profile] [-output=file] [-verbose]");
            return 1;
        }

        try
        {
            Profile profile;
            if (profileName.equals (Profile.C)  ||  profileName.equals (Profile.PYTHON)) profile = Profile.load (profileName);
            else                                                                          profile = Profile.read (Paths.get (profileName));

            Model model = new ImportCellML ().process (modelPath);
            Generator generator = new Generator (profile);
            generator.process (model);
            if (generator.errorCount () > 0)
            {
                for (Issue issue : generator.getIssues ()) err.println (issue.description);
                return 1;
            }

            String code = generator.code ();
            if (outputPath == null) out.print (code);
            else                    Files.write (outputPath, code.getBytes (StandardCharsets.UTF_8));
            return 0;
        }
        catch (IOException | ImportException e)
        {
            err.println (e.getMessage ());
            return 1;
        }
    }
}

/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.odegen.eqset.EquationEntry;
import gov.sandia.odegen.eqset.EquationSet;
import gov.sandia.odegen.eqset.Issue;
import gov.sandia.odegen.eqset.VariableEntry;
import gov.sandia.odegen.language.MathFunction;
import gov.sandia.odegen.language.Renderer;
import gov.sandia.odegen.model.Model;

/**
    Turns a model into code for a numerical integrator.
    Call process(), check errorCount(), then retrieve the generated blocks. All blocks are empty
    if there are any errors. Each call to process() starts over from scratch, so one instance
    can be reused, but not shared between threads.
**/
public class Generator
{
    private static Logger logger = Logger.getLogger (Generator.class);

    public enum ModelType
    {
        UNKNOWN,
        ALGEBRAIC,
        ODE
    }

    protected Profile     profile;
    protected EquationSet equations;  // null until process() is called

    // Generated text, filled in by emit()
    protected String                initialize = "";
    protected String                constants  = "";
    protected String                rates      = "";
    protected String                algebraic  = "";
    protected EnumSet<MathFunction> needed     = EnumSet.noneOf (MathFunction.class);

    public Generator ()
    {
        this (Profile.defaultProfile ());
    }

    public Generator (Profile profile)
    {
        this.profile = profile;
    }

    public Profile getProfile ()
    {
        return profile;
    }

    /**
        Changes the target language. If a model has already been processed, its code is regenerated.
    **/
    public void setProfile (Profile profile)
    {
        this.profile = profile;
        emit ();
    }

    public void process (Model model)
    {
        logger.debug ("processing model " + model.name);
        equations = new EquationSet (model);
        equations.analyze ();
        emit ();
        logger.debug ("model " + model.name + ": " + errorCount () + " errors, " + stateCount () + " states, " + variableCount () + " variables");
    }

    protected void emit ()
    {
        initialize = "";
        constants  = "";
        rates      = "";
        algebraic  = "";
        needed     = EnumSet.noneOf (MathFunction.class);
        if (! hasValidModel ()) return;

        Renderer renderer = new Renderer (profile);
        String terminator = profile.terminator ();

        StringBuilder block = new StringBuilder ();
        for (VariableEntry v : equations.registry.entries)
        {
            if (v.role != VariableEntry.Role.STATE  &&  v.role != VariableEntry.Role.CONSTANT) continue;
            block.append (renderer.variable (v, null) + profile.operator ("eq") + v.variable.initialValue + terminator + "\n");
        }
        block.append (render (renderer, EquationEntry.Type.TRUE_CONSTANT));
        initialize = block.toString ();

        constants = render (renderer, EquationEntry.Type.VARIABLE_BASED_CONSTANT);
        rates     = render (renderer, EquationEntry.Type.RATE);
        algebraic = render (renderer, EquationEntry.Type.ALGEBRAIC);
        needed    = renderer.needed;
    }

    protected String render (Renderer renderer, EquationEntry.Type type)
    {
        String terminator = profile.terminator ();
        StringBuilder block = new StringBuilder ();
        for (EquationEntry e : equations.ordered (type))
        {
            block.append (renderer.code (e.root, null));
            block.append (terminator);
            block.append ("\n");
        }
        return block.toString ();
    }

    public boolean hasValidModel ()
    {
        return equations != null  &&  equations.issues.isEmpty ();
    }

    public List<Issue> getIssues ()
    {
        if (equations == null) return Collections.emptyList ();
        return Collections.unmodifiableList (equations.issues);
    }

    public int errorCount ()
    {
        return getIssues ().size ();
    }

    public Issue error (int index)
    {
        return getIssues ().get (index);
    }

    public ModelType modelType ()
    {
        if (! hasValidModel ()) return ModelType.UNKNOWN;
        if (equations.integrationVariable != null) return ModelType.ODE;
        return ModelType.ALGEBRAIC;
    }

    public int stateCount ()
    {
        if (! hasValidModel ()) return 0;
        return equations.stateCount ();
    }

    public int variableCount ()
    {
        if (! hasValidModel ()) return 0;
        return equations.variableCount ();
    }

    /**
        @return "component.name" for each slot of the states array, in index order.
    **/
    public List<String> stateNames ()
    {
        return names (true);
    }

    /**
        @return "component.name" for each slot of the variables array, in index order.
    **/
    public List<String> variableNames ()
    {
        return names (false);
    }

    protected List<String> names (boolean states)
    {
        List<String> result = new ArrayList<String> ();
        if (! hasValidModel ()) return result;
        for (VariableEntry v : equations.indexed (states)) result.add (v.variable.toString ());
        return result;
    }

    /**
        @return Definitions of the helper functions used by the generated code, separated by blank lines.
    **/
    public String neededMathMethods ()
    {
        StringBuilder result = new StringBuilder ();
        for (MathFunction f : needed)
        {
            String source = profile.function (f);
            if (source.isEmpty ()) continue;
            result.append (source);
            result.append ("\n\n");
        }
        return result.toString ();
    }

    public String initializeVariables ()
    {
        return initialize;
    }

    public String computeConstantEquations ()
    {
        return constants;
    }

    public String computeRateEquations ()
    {
        return rates;
    }

    public String computeAlgebraicEquations ()
    {
        return algebraic;
    }

    /**
        Assembles a complete source file from the profile's file templates.
    **/
    public String code ()
    {
        if (! hasValidModel ()) return "";

        List<String> sections = new ArrayList<String> ();
        sections.add (profile.file ("header"));
        sections.add (count ("stateCount", stateCount ()) + "\n" + count ("variableCount", variableCount ()));
        sections.add (neededMathMethods ());
        sections.add (function ("initialize", initialize));
        sections.add (function ("constants",  constants));
        sections.add (function ("rates",      rates));
        sections.add (function ("algebraic",  algebraic));

        StringBuilder result = new StringBuilder ();
        for (String s : sections)
        {
            s = s.stripTrailing ();
            if (s.isEmpty ()) continue;
            if (result.length () > 0) result.append ("\n\n");
            result.append (s);
        }
        result.append ("\n");
        return result.toString ();
    }

    protected String count (String key, int value)
    {
        return Renderer.replace (profile.file (key), "#count", String.valueOf (value));
    }

    /**
        Wraps a block of statements in the profile's function template, indenting each line.
    **/
    protected String function (String key, String block)
    {
        String indent = profile.indent ();
        StringBuilder body = new StringBuilder ();
        for (String line : block.split ("\n"))
        {
            if (line.isEmpty ()) continue;
            body.append (indent + line + "\n");
        }
        if (body.length () == 0)
        {
            String empty = profile.get ("statement", "empty");
            if (! empty.isEmpty ()) body.append (indent + empty + "\n");
        }
        return Renderer.replace (profile.file (key), "#code", body.toString ());
    }
}

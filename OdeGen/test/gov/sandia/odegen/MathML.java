/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen;

/**
    Shorthand for writing MathML in tests.
**/
public class MathML
{
    public static String math (String... equations)
    {
        return "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">" + String.join ("", equations) + "</math>";
    }

    public static String ci (String name)
    {
        return "<ci>" + name + "</ci>";
    }

    public static String cn (String value)
    {
        return "<cn>" + value + "</cn>";
    }

    public static String apply (String operator, String... operands)
    {
        return "<apply><" + operator + "/>" + String.join ("", operands) + "</apply>";
    }

    public static String eq (String left, String right)
    {
        return apply ("eq", left, right);
    }

    public static String diff (String t, String x)
    {
        return apply ("diff", "<bvar>" + ci (t) + "</bvar>", ci (x));
    }

    public static String diff (String t, String degree, String x)
    {
        return apply ("diff", "<bvar>" + ci (t) + "<degree>" + cn (degree) + "</degree></bvar>", ci (x));
    }

    public static String qualifier (String name, String value)
    {
        return "<" + name + ">" + cn (value) + "</" + name + ">";
    }

    public static String piecewise (String... pieces)
    {
        return "<piecewise>" + String.join ("", pieces) + "</piecewise>";
    }

    public static String piece (String value, String condition)
    {
        return "<piece>" + value + condition + "</piece>";
    }

    public static String otherwise (String value)
    {
        return "<otherwise>" + value + "</otherwise>";
    }
}

/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.language;

/**
    Functions that a target language may lack, so generated code must carry its own definition.
    The key names the helper source in the profile, under "function".
**/
public enum MathFunction
{
    SQUARE    ("square"),
    FACTORIAL ("factorial"),
    MIN       ("min"),
    MAX       ("max"),
    GCD       ("gcd"),
    LCM       ("lcm"),
    XOR       ("xor"),
    SEC       ("sec"),
    CSC       ("csc"),
    COT       ("cot"),
    SECH      ("sech"),
    CSCH      ("csch"),
    COTH      ("coth"),
    ASEC      ("asec"),
    ACSC      ("acsc"),
    ACOT      ("acot"),
    ASECH     ("asech"),
    ACSCH     ("acsch"),
    ACOTH     ("acoth");

    public final String key;

    MathFunction (String key)
    {
        this.key = key;
    }
}

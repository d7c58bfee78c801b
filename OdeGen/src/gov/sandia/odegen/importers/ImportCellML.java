/*
Copyright 2023 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.odegen.importers;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import gov.sandia.odegen.language.MathParser;
import gov.sandia.odegen.model.Component;
import gov.sandia.odegen.model.Model;
import gov.sandia.odegen.model.Variable;

/**
    Reads a CellML document (1.0, 1.1 or 2.0) into model records.
    Only the parts needed for code generation are read: components, their variables and math,
    the encapsulation hierarchy, and variable connections. Imports and units are ignored.
**/
public class ImportCellML
{
    private static Logger logger = Logger.getLogger (ImportCellML.class);

    public static final String XMLNS = "http://www.w3.org/2000/xmlns/";

    protected Model                  model;
    protected Map<String,Component>  components = new LinkedHashMap<String,Component> ();  // in document order
    protected Map<String,Element>    maths      = new LinkedHashMap<String,Element> ();
    protected Set<String>            children   = new HashSet<String> ();                 // components that have an encapsulation parent
    protected List<Node>             connections = new ArrayList<Node> ();

    public Model process (Path source) throws ImportException
    {
        try (InputStream stream = Files.newInputStream (source))
        {
            return process (stream);
        }
        catch (IOException e)
        {
            throw new ImportException ("Can't read " + source + ": " + e.getMessage (), e);
        }
    }

    public Model process (InputStream stream) throws ImportException
    {
        Document doc;
        try
        {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
            factory.setNamespaceAware (true);
            factory.setCoalescing (true);
            factory.setIgnoringComments (true);
            DocumentBuilder builder = factory.newDocumentBuilder ();
            doc = builder.parse (stream);
        }
        catch (ParserConfigurationException e)
        {
            throw new ImportException ("XML parser is not available", e);
        }
        catch (SAXException | IOException e)
        {
            throw new ImportException ("Malformed CellML: " + e.getMessage (), e);
        }
        return process (doc);
    }

    public Model process (Document doc) throws ImportException
    {
        Element root = doc.getDocumentElement ();
        if (! "model".equals (root.getLocalName ())) throw new ImportException ("Root element is not a CellML model");

        model = new Model (root.getAttribute ("name"));
        components.clear ();
        maths.clear ();
        children.clear ();
        connections.clear ();

        for (Node child = root.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (child.getNodeType () != Node.ELEMENT_NODE) continue;
            switch (child.getLocalName ())
            {
                case "component":
                    component (child);
                    break;
                case "encapsulation":  // CellML 2.0
                    for (Node c = child.getFirstChild (); c != null; c = c.getNextSibling ())
                    {
                        if (isElement (c, "component_ref")) encapsulate (c, null);
                    }
                    break;
                case "group":  // CellML 1.x
                    if (isEncapsulation (child))
                    {
                        for (Node c = child.getFirstChild (); c != null; c = c.getNextSibling ())
                        {
                            if (isElement (c, "component_ref")) encapsulate (c, null);
                        }
                    }
                    break;
                case "connection":
                    connections.add (child);
                    break;
            }
        }

        for (Component c : components.values ())
        {
            if (! children.contains (c.name)) model.addComponent (c);
        }
        for (Node connection : connections) connection (connection, root);
        for (Map.Entry<String,Element> m : maths.entrySet ()) components.get (m.getKey ()).math = serialize (m.getValue (), root);

        logger.debug ("imported model " + model.name + " with " + components.size () + " components");
        return model;
    }

    public void component (Node node) throws ImportException
    {
        String name = getAttribute (node, "name");
        if (components.containsKey (name)) throw new ImportException ("Duplicate component '" + name + "'");
        Component c = new Component (name);
        components.put (name, c);

        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (child.getNodeType () != Node.ELEMENT_NODE) continue;
            if (isElement (child, "variable"))
            {
                String initial = getAttribute (child, "initial_value");
                c.addVariable (getAttribute (child, "name"), getAttribute (child, "units"), initial.isEmpty () ? null : initial);
            }
            else if (MathParser.isMathML (child)  &&  child.getLocalName ().equals ("math"))
            {
                // Multiple math elements are merged into the first, so the component has a single math document.
                Element first = maths.get (name);
                if (first == null)
                {
                    maths.put (name, (Element) child);
                }
                else
                {
                    for (Node m = child.getFirstChild (); m != null; m = m.getNextSibling ()) first.appendChild (m.cloneNode (true));
                }
            }
        }
    }

    public void encapsulate (Node ref, Component parent) throws ImportException
    {
        String name = getAttribute (ref, "component");
        Component c = components.get (name);
        if (c == null) throw new ImportException ("Encapsulation refers to unknown component '" + name + "'");
        if (parent != null)
        {
            if (children.contains (name)) throw new ImportException ("Component '" + name + "' has more than one encapsulation parent");
            children.add (name);
            parent.addComponent (c);
        }
        for (Node child = ref.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (isElement (child, "component_ref")) encapsulate (child, c);
        }
    }

    public void connection (Node node, Element root) throws ImportException
    {
        // CellML 2.0 puts the component names on the connection itself. 1.x uses a map_components child.
        String name1 = getAttribute (node, "component_1");
        String name2 = getAttribute (node, "component_2");
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (isElement (child, "map_components"))
            {
                name1 = getAttribute (child, "component_1");
                name2 = getAttribute (child, "component_2");
            }
        }
        Component c1 = components.get (name1);
        Component c2 = components.get (name2);
        if (c1 == null  ||  c2 == null) throw new ImportException ("Connection refers to unknown component '" + (c1 == null ? name1 : name2) + "'");

        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (! isElement (child, "map_variables")) continue;
            String variable1 = getAttribute (child, "variable_1");
            String variable2 = getAttribute (child, "variable_2");
            Variable v1 = c1.variable (variable1);
            Variable v2 = c2.variable (variable2);
            if (v1 == null) throw new ImportException ("Unknown variable '" + variable1 + "' in component '" + name1 + "'");
            if (v2 == null) throw new ImportException ("Unknown variable '" + variable2 + "' in component '" + name2 + "'");
            Variable.addEquivalence (v1, v2);
        }
    }

    /**
        Converts a math element back into text. Namespace declarations made on the model root
        are copied onto the math element, so the text can be parsed on its own.
    **/
    public static String serialize (Element math, Element root) throws ImportException
    {
        NamedNodeMap attributes = root.getAttributes ();
        for (int i = 0; i < attributes.getLength (); i++)
        {
            Node a = attributes.item (i);
            if (! XMLNS.equals (a.getNamespaceURI ())) continue;
            if (! math.hasAttributeNS (XMLNS, a.getLocalName ())) math.setAttributeNS (XMLNS, a.getNodeName (), a.getNodeValue ());
        }

        try
        {
            Transformer transformer = TransformerFactory.newInstance ().newTransformer ();
            transformer.setOutputProperty (OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter ();
            transformer.transform (new DOMSource (math), new StreamResult (writer));
            return writer.toString ();
        }
        catch (TransformerException e)
        {
            throw new ImportException ("Can't serialize math: " + e.getMessage (), e);
        }
    }

    public static boolean isEncapsulation (Node group)
    {
        for (Node child = group.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (isElement (child, "relationship_ref")  &&  getAttribute (child, "relationship").equals ("encapsulation")) return true;
        }
        return false;
    }

    public static boolean isElement (Node node, String name)
    {
        return node.getNodeType () == Node.ELEMENT_NODE  &&  name.equals (node.getLocalName ());
    }

    public static String getAttribute (Node node, String name)
    {
        Node a = node.getAttributes ().getNamedItem (name);
        if (a == null) return "";
        return a.getNodeValue ();
    }
}

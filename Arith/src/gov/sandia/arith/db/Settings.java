/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.db;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;

/**
    Process-wide configuration of the simplification engine.
    Values come from the bundled "settings" document, and each top-level key may be overridden
    by a system property named "arith.<key>". The tree is mutable, so a caller can flip a
    switch at runtime, for example to build intentionally unsimplified trees.
**/
public class Settings
{
    private static Logger logger = Logger.getLogger (Settings.class);

    public static final String resource = "/gov/sandia/arith/db/settings";
    public static final String prefix   = "arith.";

    public static MNode state = new MVolatile ();

    static
    {
        load ();
    }

    /**
        Discards the current state and reloads it from the bundled document and system properties.
    **/
    public static synchronized void load ()
    {
        state.clear ();
        state.set ("1", "simplify");
        state.set ("1", "sanityCheck");

        InputStream stream = Settings.class.getResourceAsStream (resource);
        if (stream == null)
        {
            logger.warn ("Settings document " + resource + " not found. Using defaults.");
        }
        else
        {
            try (Reader reader = new InputStreamReader (stream, StandardCharsets.UTF_8))
            {
                MNode loaded = new MVolatile ();
                Schema.readAll (loaded, reader);
                state.merge (loaded);
                logger.info ("Loaded settings from " + resource);
            }
            catch (IOException e)
            {
                logger.warn ("Failed to read " + resource + ". Using defaults.", e);
            }
        }

        for (MNode c : state)
        {
            String key = c.key ();
            String value = System.getProperty (prefix + key);
            if (value == null) continue;
            c.set (value);
            logger.info ("Setting " + key + " overridden by system property: " + value);
        }
    }

    /**
        When false, every builder degrades to raw node construction with no rule application.
    **/
    public static boolean simplify ()
    {
        return state.getOrDefault (true, "simplify");
    }

    public static boolean sanityCheck ()
    {
        return state.getOrDefault (true, "sanityCheck");
    }
}

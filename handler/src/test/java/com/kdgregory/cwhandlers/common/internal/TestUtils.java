// Copyright (c) Keith D Gregory
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.kdgregory.cwhandlers.common.internal;

import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;

import org.junit.Test;
import static org.junit.Assert.*;


public class TestUtils
{
    // used by the factory method tests
    public static String exampleFactory(String value)
    {
        return value.toUpperCase();
    }

//----------------------------------------------------------------------------
//  Tests
//----------------------------------------------------------------------------

    @Test
    public void testLoadClass() throws Exception
    {
        assertSame("existing class",    String.class,   Utils.loadClass("java.lang.String"));
        assertNull("nonexistent class",                 Utils.loadClass("com.example.DoesNotExist"));
    }


    @Test
    public void testFindMethodIfExists() throws Exception
    {
        assertNotNull("declared method",        Utils.findMethodIfExists(TestUtils.class, "exampleFactory", String.class));
        assertNotNull("inherited method",       Utils.findMethodIfExists(TestUtils.class, "hashCode"));
        assertNull("wrong parameters",          Utils.findMethodIfExists(TestUtils.class, "exampleFactory", Integer.class));
        assertNull("null class",                Utils.findMethodIfExists(null, "exampleFactory", String.class));
        assertNull("empty name",                Utils.findMethodIfExists(TestUtils.class, ""));
    }


    @Test
    public void testFindFullyQualifiedMethod() throws Exception
    {
        Method method = Utils.findFullyQualifiedMethod(getClass().getName() + ".exampleFactory", String.class);
        assertEquals("invoked method", "ARGLE", method.invoke(null, "argle"));

        assertNull("null name", Utils.findFullyQualifiedMethod(null));
    }


    @Test
    public void testFindFullyQualifiedMethodFailures() throws Exception
    {
        try
        {
            Utils.findFullyQualifiedMethod("noPackageOrClass");
            fail("accepted bare method name");
        }
        catch (IllegalArgumentException ex)
        {
            assertEquals("exception message", "invalid factory method name: noPackageOrClass", ex.getMessage());
        }

        try
        {
            Utils.findFullyQualifiedMethod("com.example.DoesNotExist.factory");
            fail("accepted nonexistent class");
        }
        catch (ClassNotFoundException ex)
        {
            assertEquals("exception message", "com.example.DoesNotExist", ex.getMessage());
        }

        try
        {
            Utils.findFullyQualifiedMethod(getClass().getName() + ".exampleFactory", Integer.class);
            fail("accepted method with wrong parameters");
        }
        catch (NoSuchMethodException ex)
        {
            // expected
        }
    }


    @Test
    public void testDecodeDroppingInvalid() throws Exception
    {
        byte[] bytes = "abcé€".getBytes(StandardCharsets.UTF_8);
        assertEquals("encoded length", 8, bytes.length);

        assertEquals("complete string",         "abcé€",  Utils.decodeDroppingInvalid(bytes, 8, StandardCharsets.UTF_8));
        assertEquals("split three-byte char",   "abcé",        Utils.decodeDroppingInvalid(bytes, 7, StandardCharsets.UTF_8));
        assertEquals("split two-byte char",     "abc",              Utils.decodeDroppingInvalid(bytes, 4, StandardCharsets.UTF_8));
        assertEquals("empty",                   "",                 Utils.decodeDroppingInvalid(bytes, 0, StandardCharsets.UTF_8));
    }
}

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

package com.kdgregory.cwhandlers.facade;

import java.lang.reflect.Constructor;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.common.internal.Utils;


/**
 *  Creates new instances of AWS facade objects. Uses reflection to determine
 *  which implementation library is linked into the application, so that this
 *  module has no compile-time dependency on the SDK.
 */
public class FacadeFactory
{
    private final static String[] FACADE_PACKAGES = new String[]
    {
        "com.kdgregory.cwhandlers.facade.v2"
    };


    /**
     *  Instantiates the facade implementation corresponding to the provided
     *  interface class, passing it the handler configuration.
     *
     *  @throws IllegalArgumentException if unable to instantiate. Exception
     *          message will provide more information.
     */
    public static <T> T createFacade(Class<T> facadeType, CloudWatchHandlerConfig config)
    {
        Class<?> implClass = findImplementationClass(facadeType);
        return facadeType.cast(instantiate(implClass, config));
    }


    /**
     *  Determines whether a facade implementation class exists in the classpath,
     *  and returns it.
     *  <p>
     *  Implementation note: the facade implementation class names are based on
     *  the interface names, so it's easier to construct the names than to use
     *  a lookup table.
     */
    private static Class<?> findImplementationClass(Class<?> facadeType)
    {
        for (String packageName : FACADE_PACKAGES)
        {
            String className = packageName + "." + facadeType.getSimpleName() + "Impl";
            Class<?> implClass = Utils.loadClass(className);
            if (implClass != null)
                return implClass;
        }

        throw new IllegalArgumentException("no implementation class for " + facadeType.getName());
    }


    private static Object instantiate(Class<?> implClass, Object... ctorArgs)
    {
        try
        {
            Constructor<?>[] ctors = implClass.getConstructors();
            if (ctors.length != 1)
            {
                throw new IllegalArgumentException("implementation class does not expose a single constructor: " + implClass.getName());
            }

            return ctors[0].newInstance(ctorArgs);
        }
        catch (IllegalArgumentException ex)
        {
            throw ex;
        }
        catch (Exception ex)
        {
            throw new IllegalArgumentException("unable to instantiate: " + implClass.getName(), ex);
        }
    }
}

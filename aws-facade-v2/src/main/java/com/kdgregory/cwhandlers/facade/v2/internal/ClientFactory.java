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

package com.kdgregory.cwhandlers.facade.v2.internal;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;

import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.common.LogsHandlerException;
import com.kdgregory.cwhandlers.common.internal.Utils;


/**
 *  Creates and configures a CloudWatch Logs client based on the provided
 *  handler configuration.
 *  <p>
 *  If the configuration names a factory method, that method is responsible for
 *  creating the client. It may either take no parameters, or take the region
 *  and endpoint (as strings, possibly null). Otherwise the client is built using
 *  the SDK's default credentials and region providers, with optional overrides.
 *  <P>
 *  Implementation note: all internal methods are protected to enable testing.
 */
public class ClientFactory<T>
{
    private Class<T> clientType;
    private CloudWatchHandlerConfig config;


    public ClientFactory(Class<T> clientType, CloudWatchHandlerConfig config)
    {
        this.clientType = clientType;
        this.config = config;
    }

//----------------------------------------------------------------------------
//  Public methods
//----------------------------------------------------------------------------

    public T create()
    {
        T client = tryInstantiateFromFactory();
        if (client != null)
            return client;

        AwsClientBuilder<?,?> builder = createClientBuilder();
        optSetRegionOrEndpoint(builder);
        return clientType.cast(builder.build());
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Determines whether the configuration specifies a factory method, and
     *  if so tries to invoke it.
     */
    protected T tryInstantiateFromFactory()
    {
        String fullyQualifiedMethodName = config.getClientFactoryMethod();
        if ((fullyQualifiedMethodName == null) || fullyQualifiedMethodName.isEmpty())
            return null;

        // lookup and invocation are separated because they throw different exceptions
        Method factoryMethod;
        try
        {
            factoryMethod = Utils.findFullyQualifiedMethod(fullyQualifiedMethodName);
        }
        catch (Exception ignored)
        {
            try
            {
                factoryMethod = Utils.findFullyQualifiedMethod(fullyQualifiedMethodName, String.class, String.class);
            }
            catch (Exception ex)
            {
                throw new LogsHandlerException("invalid factory method: " + fullyQualifiedMethodName, ex);
            }
        }

        try
        {
            return (factoryMethod.getParameterTypes().length == 0)
                 ? clientType.cast(factoryMethod.invoke(null))
                 : clientType.cast(factoryMethod.invoke(null, config.getClientRegion(), config.getClientEndpoint()));
        }
        catch (Throwable ex)
        {
            if (ex instanceof InvocationTargetException)
                ex = ex.getCause();

            throw new LogsHandlerException("exception invoking factory method: " + fullyQualifiedMethodName, ex);
        }
    }


    protected AwsClientBuilder<?,?> createClientBuilder()
    {
        return CloudWatchLogsClient.builder();
    }


    /**
     *  Applies the configured endpoint and/or region, if any.
     */
    protected void optSetRegionOrEndpoint(AwsClientBuilder<?,?> builder)
    {
        String region = config.getClientRegion();
        String endpoint = config.getClientEndpoint();

        if ((endpoint != null) && ! endpoint.isEmpty())
        {
            builder.endpointOverride(URI.create(endpoint));
        }
        if ((region != null) && ! region.isEmpty())
        {
            builder.region(Region.of(region));
        }
    }
}

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

package com.kdgregory.cwhandlers.common;

import com.kdgregory.cwhandlers.facade.ServiceResponse;


/**
 *  Thrown when the service reports a client error while creating a log group
 *  or stream, or while setting a group's retention policy. The handler does
 *  not retry these calls.
 */
public class ProvisioningException
extends LogsHandlerException
{
    private static final long serialVersionUID = 1L;

    private final String operation;
    private final transient ServiceResponse response;


    public ProvisioningException(String operation, ServiceResponse response)
    {
        super(operation + " failed: " + response);
        this.operation = operation;
        this.response = response;
    }


    /**
     *  Returns the name of the operation that failed (eg, "createLogGroup").
     */
    public String getOperation()
    {
        return operation;
    }


    /**
     *  Returns the service's response to the failed operation.
     */
    public ServiceResponse getResponse()
    {
        return response;
    }
}

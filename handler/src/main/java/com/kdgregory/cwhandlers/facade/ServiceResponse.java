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


/**
 *  The outcome of a provisioning call: the HTTP status code, and any detail
 *  provided by the service.
 *  <p>
 *  A request that fails because the resource already exists is reported with
 *  the service's status code, but is not considered a client error: it means
 *  that another writer created the resource first.
 */
public class ServiceResponse
{
    public final static int STATUS_OK = 200;
    public final static int STATUS_CLIENT_ERROR = 400;

    private final int statusCode;
    private final String detail;
    private final boolean alreadyExists;


    public ServiceResponse(int statusCode, String detail, boolean alreadyExists)
    {
        this.statusCode = statusCode;
        this.detail = detail;
        this.alreadyExists = alreadyExists;
    }


    /**
     *  Convenience factory for a successful response.
     */
    public static ServiceResponse ok()
    {
        return new ServiceResponse(STATUS_OK, null, false);
    }


    /**
     *  Convenience factory for a response reporting that the resource exists.
     */
    public static ServiceResponse alreadyExists(int statusCode, String detail)
    {
        return new ServiceResponse(statusCode, detail, true);
    }


    /**
     *  Convenience factory for a client error.
     */
    public static ServiceResponse clientError(String detail)
    {
        return new ServiceResponse(STATUS_CLIENT_ERROR, detail, false);
    }


    public int getStatusCode()
    {
        return statusCode;
    }


    public String getDetail()
    {
        return detail;
    }


    public boolean isAlreadyExists()
    {
        return alreadyExists;
    }


    /**
     *  Returns <code>true</code> if the service rejected the request as invalid.
     */
    public boolean isClientError()
    {
        return (! alreadyExists)
            && (statusCode >= 400)
            && (statusCode < 500);
    }


    @Override
    public String toString()
    {
        return "ServiceResponse[status=" + statusCode
             + (alreadyExists ? ", alreadyExists" : "")
             + ((detail != null) ? ", detail=" + detail : "")
             + "]";
    }
}

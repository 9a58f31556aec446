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

package com.kdgregory.cwhandlers.cloudwatch;


/**
 *  Controls what happens to the buffered events when the service reports
 *  that some of them were rejected. In both cases <code>flush()</code>
 *  throws <code>DeliveryException</code>.
 */
public enum RejectionPolicy
{
    /**
     *  Keep the buffer intact, so that the next flush resubmits the entire
     *  batch. This is the default.
     */
    RETAIN,

    /**
     *  Clear the buffer, so that the rejected batch is never resubmitted.
     */
    DISCARD;


    /**
     *  Returns the policy corresponding to the passed value, ignoring case.
     *  Returns <code>null</code> if the value doesn't match any policy.
     */
    public static RejectionPolicy lookup(String value)
    {
        if (value == null)
            return null;

        for (RejectionPolicy policy : values())
        {
            if (policy.name().equalsIgnoreCase(value.trim()))
                return policy;
        }
        return null;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 *  One page of results from a describe call, along with the token used to
 *  retrieve the next page (<code>null</code> when there are no more pages).
 */
public class DescribeResult<T>
{
    private final List<T> items;
    private final String nextToken;


    public DescribeResult(List<T> items, String nextToken)
    {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.nextToken = ((nextToken == null) || nextToken.isEmpty()) ? null : nextToken;
    }


    public List<T> getItems()
    {
        return items;
    }


    public String getNextToken()
    {
        return nextToken;
    }
}

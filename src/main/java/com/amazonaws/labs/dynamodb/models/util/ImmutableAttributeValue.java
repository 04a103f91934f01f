/**
 * Copyright 2013-2013 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Amazon Software License (the "License"). 
 * You may not use this file except in compliance with the License. 
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/asl/
 *
 * or in the "license" file accompanying this file. This file is distributed 
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, express 
 * or implied. See the License for the specific language governing permissions 
 * and limitations under the License. 
 */
package com.amazonaws.labs.dynamodb.models.util;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * An immutable class that can be used in map keys.  Does a deep copy of the attribute value
 * to prevent any member from being mutated, including nested list and map values.
 */
public class ImmutableAttributeValue {

    private final String n;
    private final String s;
    private final byte[] b;
    private final List<String> ns;
    private final List<String> ss;
    private final List<byte[]> bs;
    private final Boolean bool;
    private final Boolean nul;
    private final List<ImmutableAttributeValue> l;
    private final Map<String, ImmutableAttributeValue> m;

    public ImmutableAttributeValue(AttributeValue av) {
        s = av.getS();
        n = av.getN();
        b = av.getB() != null ? toBytes(av.getB()) : null;
        ns = av.getNS() != null ? new ArrayList<String>(av.getNS()) : null;
        ss = av.getSS() != null ? new ArrayList<String>(av.getSS()) : null;
        bs = av.getBS() != null ? new ArrayList<byte[]>(av.getBS().size()) : null;
        bool = av.getBOOL();
        nul = av.getNULL();

        if(av.getBS() != null) {
            for(ByteBuffer buf : av.getBS()) {
                if(buf != null) {
                    bs.add(toBytes(buf));
                } else {
                    bs.add(null);
                }
            }
        }

        if(av.getL() != null) {
            List<ImmutableAttributeValue> list = new ArrayList<ImmutableAttributeValue>(av.getL().size());
            for(AttributeValue element : av.getL()) {
                list.add(new ImmutableAttributeValue(element));
            }
            l = Collections.unmodifiableList(list);
        } else {
            l = null;
        }

        if(av.getM() != null) {
            Map<String, ImmutableAttributeValue> map = new TreeMap<String, ImmutableAttributeValue>();
            for(Map.Entry<String, AttributeValue> e : av.getM().entrySet()) {
                map.put(e.getKey(), new ImmutableAttributeValue(e.getValue()));
            }
            m = Collections.unmodifiableMap(map);
        } else {
            m = null;
        }
    }

    // Reads the remaining bytes without moving the caller's buffer position.
    private static byte[] toBytes(ByteBuffer buf) {
        ByteBuffer dup = buf.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        return bytes;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.hashCode(b);
        if(bs != null) {
            for(byte[] element : bs) {
                result = prime * result + Arrays.hashCode(element);
            }
        }
        result = prime * result + ((n == null) ? 0 : n.hashCode());
        result = prime * result + ((ns == null) ? 0 : ns.hashCode());
        result = prime * result + ((s == null) ? 0 : s.hashCode());
        result = prime * result + ((ss == null) ? 0 : ss.hashCode());
        result = prime * result + ((bool == null) ? 0 : bool.hashCode());
        result = prime * result + ((nul == null) ? 0 : nul.hashCode());
        result = prime * result + ((l == null) ? 0 : l.hashCode());
        result = prime * result + ((m == null) ? 0 : m.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ImmutableAttributeValue other = (ImmutableAttributeValue) obj;
        if (!Arrays.equals(b, other.b))
            return false;
        if (bs == null) {
            if (other.bs != null)
                return false;
        }
        else {
            if(other.bs == null)
                return false;
            if(bs.size() != other.bs.size())
                return false;
            for(int i = 0; i < bs.size(); i++) {
                if (!Arrays.equals(bs.get(i), other.bs.get(i)))
                    return false;
            }
        }
        if (!equal(n, other.n))
            return false;
        if (!equal(ns, other.ns))
            return false;
        if (!equal(s, other.s))
            return false;
        if (!equal(ss, other.ss))
            return false;
        if (!equal(bool, other.bool))
            return false;
        if (!equal(nul, other.nul))
            return false;
        if (!equal(l, other.l))
            return false;
        return equal(m, other.m);
    }

    private static boolean equal(Object a, Object b) {
        return (a == null) ? b == null : a.equals(b);
    }

}

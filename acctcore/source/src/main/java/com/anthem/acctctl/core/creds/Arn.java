package com.anthem.acctctl.core.creds;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Amazon Resource Name: {@code arn:partition:service:region:account:resource}.
 */
public final class Arn {

    private final String partition;
    private final String service;
    private final String region;
    private final String account;
    private final String resource;

    private Arn(String partition, String service, String region, String account, String resource) {
        this.partition = partition;
        this.service = service;
        this.region = region;
        this.account = account;
        this.resource = resource;
    }

    public static Arn of(String partition, String service, String region, String account, String resource) {
        return new Arn(partition, service, region, account, resource);
    }

    /**
     * Parses an ARN string.
     *
     * @throws IllegalArgumentException if {@code s} is not an ARN
     */
    @JsonCreator
    public static Arn parse(String s) {
        if (s == null) {
            throw new IllegalArgumentException("arn is null");
        }
        String[] parts = s.split(":", 6);
        if (parts.length != 6 || !"arn".equals(parts[0])) {
            throw new IllegalArgumentException("invalid arn: " + s);
        }
        return new Arn(parts[1], parts[2], parts[3], parts[4], parts[5]);
    }

    public String getPartition() {
        return partition;
    }

    public String getService() {
        return service;
    }

    public String getRegion() {
        return region;
    }

    public String getAccount() {
        return account;
    }

    public String getResource() {
        return resource;
    }

    /**
     * Resource type, e.g. "user", "role" or "assumed-role".
     */
    public String type() {
        int i = indexOfSep(resource);
        return i < 0 ? resource : resource.substring(0, i);
    }

    /**
     * Last path component of the resource.
     */
    public String name() {
        int i = Math.max(resource.lastIndexOf('/'), resource.lastIndexOf(':'));
        return resource.substring(i + 1);
    }

    /**
     * Resource path between the type and the name, always starting and ending with "/".
     */
    public String path() {
        int i = indexOfSep(resource);
        int j = resource.lastIndexOf('/');
        if (i < 0 || j <= i) {
            return "/";
        }
        return resource.substring(i, j + 1);
    }

    public Arn withAccount(String acct) {
        return new Arn(partition, service, region, acct, resource);
    }

    private static int indexOfSep(String r) {
        int i = r.indexOf('/');
        int j = r.indexOf(':');
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    @JsonValue
    @Override
    public String toString() {
        return "arn:" + partition + ":" + service + ":" + region + ":" + account + ":" + resource;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Arn && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(partition, service, region, account, resource);
    }
}

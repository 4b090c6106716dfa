package com.anthem.acctctl.core.ctl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Account control information: exclusive owner, free-text description and
 * tags. Instances are immutable and tags are kept sorted and unique, so equal
 * records always encode identically.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"owner", "desc", "tags"})
public final class Ctl {

    public static final Ctl EMPTY = new Ctl("", "", List.of());

    private final String owner;
    private final String desc;
    private final List<String> tags;

    @JsonCreator
    public Ctl(@JsonProperty("owner") String owner,
               @JsonProperty("desc") String desc,
               @JsonProperty("tags") Collection<String> tags) {
        this.owner = owner != null ? owner : "";
        this.desc = desc != null ? desc : "";
        this.tags = Tags.normalize(tags);
    }

    public String getOwner() {
        return owner;
    }

    public String getDesc() {
        return desc;
    }

    public List<String> getTags() {
        return tags;
    }

    @JsonIgnore
    public boolean isOwned() {
        return !owner.isEmpty();
    }

    public Ctl withOwner(String o) {
        return new Ctl(o, desc, tags);
    }

    public Ctl withDesc(String d) {
        return new Ctl(owner, d, tags);
    }

    public Ctl withTags(Collection<String> t) {
        return new Ctl(owner, desc, t);
    }

    /**
     * Performs a 3-way merge of local changes in this record with concurrent
     * changes in {@code cur}, relative to the last confirmed state {@code ref}.
     * Fields unchanged from {@code ref} adopt the value from {@code cur}; tags
     * added or removed locally are applied on top of {@code cur}'s tags.
     */
    public Ctl merge(Ctl cur, Ctl ref) {
        String o = owner.equals(ref.owner) ? cur.owner : owner;
        String d = desc.equals(ref.desc) ? cur.desc : desc;
        List<String> t = Tags.apply(cur.tags, Tags.diff(tags, ref.tags));
        return new Ctl(o, d, t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ctl)) return false;
        Ctl ctl = (Ctl) o;
        return owner.equals(ctl.owner) && desc.equals(ctl.desc) && tags.equals(ctl.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, desc, tags);
    }

    @Override
    public String toString() {
        return "Ctl{owner=" + owner + ", desc=" + desc + ", tags=" + tags + "}";
    }
}

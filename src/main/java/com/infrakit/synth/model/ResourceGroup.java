package com.infrakit.synth.model;

import java.util.List;

/**
 * Resources produced together by one builder (e.g. a function with its generated role
 * and log group). Registered as a unit.
 */
public interface ResourceGroup {

    List<Resource> getResources();
}

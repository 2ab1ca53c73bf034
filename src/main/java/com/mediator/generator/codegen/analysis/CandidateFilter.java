package com.mediator.generator.codegen.analysis;

import com.mediator.generator.catalog.model.TypeDescriptor;

/**
 * Cheap pre-filter run before any semantic resolution: only types that declare an
 * extends or implements clause can implement the contract.
 *
 * Must never drop a real handler; letting an unrelated type through only costs a
 * lookup later.
 */
public class CandidateFilter {

    public boolean isCandidate(TypeDescriptor type) {
        return type.hasDeclaredBaseTypes();
    }
}

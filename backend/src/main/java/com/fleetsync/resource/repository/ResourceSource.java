package com.fleetsync.resource.repository;

import com.fleetsync.resource.model.Resource;
import java.util.List;

public interface ResourceSource {

    String environment();

    /**
     * Fails when no valid session can be obtained for the environment.
     */
    void openSession();

    /**
     * Complete resource list of the environment; a failure means no usable list.
     */
    List<Resource> listResources();
}

package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;

import java.util.List;

/**
 * Third-party job search. Returned listings have no id yet.
 */
public interface ListingSource {

    Result<List<Candidate>> fetchListings();
}

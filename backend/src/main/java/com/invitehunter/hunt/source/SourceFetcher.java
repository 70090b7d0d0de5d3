package com.invitehunter.hunt.source;

import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.List;

/**
 * One fetch strategy bound to its parameters. Implementations return at most
 * {@link PollSettings#maxPostsPerSource()} records in source order.
 */
public interface SourceFetcher {

    List<SourcePost> fetch(PollSettings settings) throws SourceFetchException;
}

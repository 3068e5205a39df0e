package front.migrator.app.model;

import lombok.Value;

import java.util.List;

/**
 * One page of a cursor-paginated Front listing.
 */
@Value
public class FrontPage<T> {
    List<T> results;
    String nextPageToken;

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}

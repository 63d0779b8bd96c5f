package mta.nzb.checker.service.nzb;

import mta.nzb.checker.exception.NzbFetchException;
import mta.nzb.checker.model.FetchedNzb;

/**
 * Downloads NZB documents.
 */
public interface NzbFetcher {

    /**
     * @param url   NZB download URL
     * @param title release title, used when neither response nor URL names the file
     * @return payload and derived file name
     * @throws NzbFetchException on transport failure or a non-success status
     */
    FetchedNzb fetch(String url, String title);
}

package in.castsync.adapters;

import in.castsync.domain.stream.KickStream;
import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.PlatformStreamRecord;
import in.castsync.domain.stream.TwitchStream;
import in.castsync.domain.stream.YouTubeStream;

/**
 * Selects the adapter for a platform snapshot.
 */
public final class StreamAdapters {

    public static StreamAdapter of(PlatformStream platformStream) {
        if (platformStream instanceof TwitchStream) {
            return new TwitchStreamAdapter((TwitchStream) platformStream);
        }
        if (platformStream instanceof KickStream) {
            return new KickStreamAdapter((KickStream) platformStream);
        }
        if (platformStream instanceof YouTubeStream) {
            return new YouTubeStreamAdapter((YouTubeStream) platformStream);
        }
        throw new IllegalArgumentException("Unsupported platform stream: "
            + (platformStream == null ? "null" : platformStream.getClass().getName()));
    }

    public static StreamAdapter of(PlatformStreamRecord record) {
        return of(record.data());
    }

    private StreamAdapters() {}
}

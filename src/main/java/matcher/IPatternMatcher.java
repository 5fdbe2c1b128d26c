package matcher;

import search.Match;
import search.ScanStats;

import java.util.ArrayList;

public interface IPatternMatcher {

    ArrayList<Match> report(CharSequence text);

    boolean exists(CharSequence text);

    int patternCount();

    // Counters of the most recent report/exists call, or null if the matcher does not keep any.
    ScanStats getLatestStats();
}

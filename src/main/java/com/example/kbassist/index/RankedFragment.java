package com.example.kbassist.index;

import com.example.kbassist.model.Fragment;
import java.util.Comparator;

/** Search candidate; ties on distance keep insertion order. */
record RankedFragment(Fragment fragment, double distance, int position) {

    static final Comparator<RankedFragment> NEAREST_FIRST = Comparator.comparingDouble(RankedFragment::distance)
            .thenComparingInt(RankedFragment::position);
}

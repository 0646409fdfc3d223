package com.jobagents.matching;

import com.jobagents.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SkipListTest {

    @Test
    public void testParseAndNormalize() {
        SkipList skipList = SkipList.parse("Data Engineer|Acme; ;Intern|Initech");

        assertEquals(2, skipList.size());
        assertTrue(skipList.contains(new Candidate(1L, "data  engineer", " ACME ", "d")));
        assertTrue(skipList.contains(new Candidate(2L, "Intern", "Initech", "d")));
        assertFalse(skipList.contains(new Candidate(3L, "Data Engineer", "Initech", "d")));
    }

    @Test
    public void testEmpty() {
        assertEquals(0, SkipList.parse(null).size());
        assertEquals(0, SkipList.parse("").size());
        assertFalse(SkipList.empty().contains(new Candidate(1L, "a", "b", "c")));
    }

    @Test
    public void testOfAndAdd() {
        SkipList skipList = SkipList.of(List.of("Analyst|Globex"));
        skipList.add("Recruiter", "Acme");

        assertTrue(skipList.contains(new Candidate(5L, "analyst", "globex", "d")));
        assertTrue(skipList.contains(new Candidate(6L, "Recruiter", "Acme", "d")));
    }
}

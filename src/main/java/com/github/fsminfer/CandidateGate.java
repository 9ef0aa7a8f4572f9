package com.github.fsminfer;

/**
 * This represents the test a group of same-enum variables has to pass before a graph is built for
 * it.
 */
public enum CandidateGate {
  // every group with a state register becomes a graph, including plain data enums.
  NONE,
  // keep the variables that look like fsm state: the variable or enum name contains "state", a
  // case construct of the scope mentions the variable, or a clocked block assigns it.
  FSM_CANDIDATE,
  // only report a group when some case construct of the scope switches on the chosen register.
  CASE_ON_REGISTER;
}
